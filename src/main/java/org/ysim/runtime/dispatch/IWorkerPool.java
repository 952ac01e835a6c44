package org.ysim.runtime.dispatch;

import java.util.List;

/**
 * Executes one batch of independent tasks at a time.
 * <p>
 * In-process thread pools and the sequential fallback implement this interface; the dispatcher
 * sees no difference between them apart from wall-clock time. Tasks handed to a pool must not
 * throw; a task that does is reported by {@link Batch#await()} after the rest of the batch ran.
 */
public interface IWorkerPool {

    /**
     * Starts executing a batch. May return before the tasks have run.
     *
     * @param tasks tasks of the batch, executed in no particular order
     * @return handle to wait for the batch
     * @throws IllegalStateException if the previous batch has not been awaited or the pool is shut down
     */
    Batch submit(List<? extends Runnable> tasks);

    /**
     * @return the maximum number of tasks this pool runs at the same time
     */
    int getConcurrency();

    /**
     * Releases the pool's threads. Idempotent.
     */
    void shutdown();

    /**
     * A submitted batch.
     */
    interface Batch {

        /**
         * Blocks until every task of the batch has finished.
         *
         * @throws InterruptedException if the waiting thread was interrupted; the batch still
         *                              completed before this is thrown
         * @throws RuntimeException     wrapping the first exception a task threw
         */
        void await() throws InterruptedException;
    }

    /** A batch that is already complete. */
    Batch DONE = () -> { };
}
