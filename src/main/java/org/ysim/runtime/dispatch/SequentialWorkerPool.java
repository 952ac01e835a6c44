package org.ysim.runtime.dispatch;

import java.util.List;

/**
 * Fallback pool that runs each batch inline on the submitting thread, in list order.
 */
public final class SequentialWorkerPool implements IWorkerPool {

    @Override
    public Batch submit(List<? extends Runnable> tasks) {
        RuntimeException first = null;
        for (Runnable task : tasks) {
            try {
                task.run();
            } catch (RuntimeException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            RuntimeException failure = first;
            return () -> {
                throw failure;
            };
        }
        return DONE;
    }

    @Override
    public int getConcurrency() {
        return 1;
    }

    @Override
    public void shutdown() {
        // No threads to release.
    }
}
