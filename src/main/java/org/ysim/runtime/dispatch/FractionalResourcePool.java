package org.ysim.runtime.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for heavy actions, bounded by a fractional share of an inference accelerator.
 * <p>
 * A logical capacity (for example {@code 1.0} accelerator) is divided into units of
 * {@code unit} each; the pool never runs more than {@code floor(capacity / unit)} tasks at the
 * same time. Further tasks of a batch wait in the executor queue. How many tasks a batch may
 * queue at all is decided by the dispatcher before submission.
 */
public class FractionalResourcePool implements IWorkerPool {

    private final int slots;
    private final ExecutorService executor;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private volatile boolean pending;

    /**
     * @param capacity logical accelerator capacity, &gt; 0
     * @param unit     share of the capacity one task occupies, in {@code (0, capacity]}
     * @throws IllegalArgumentException if the unit does not fit the capacity
     */
    public FractionalResourcePool(double capacity, double unit) {
        this.slots = slotsFor(capacity, unit);
        AtomicInteger threadIndex = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "heavy-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(slots, factory);
    }

    /**
     * Number of concurrent tasks a capacity admits at a given unit size.
     *
     * @throws IllegalArgumentException if {@code capacity <= 0}, {@code unit <= 0} or {@code unit > capacity}
     */
    public static int slotsFor(double capacity, double unit) {
        if (!(capacity > 0.0) || !(unit > 0.0) || unit > capacity) {
            throw new IllegalArgumentException("Heavy unit must lie in (0, capacity], got unit=" + unit
                    + " capacity=" + capacity);
        }
        // 1e-9 keeps 1.0 / 0.1 from flooring to 9.
        return (int) Math.floor(capacity / unit + 1e-9);
    }

    @Override
    public Batch submit(List<? extends Runnable> tasks) {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Pool has been shut down");
        }
        if (pending) {
            throw new IllegalStateException("Previous batch has not been awaited");
        }
        if (tasks.isEmpty()) {
            return DONE;
        }
        pending = true;
        List<Future<?>> futures = new ArrayList<>(tasks.size());
        for (Runnable task : tasks) {
            futures.add(executor.submit(() -> runMetered(task)));
        }
        return () -> awaitAll(futures);
    }

    private void runMetered(Runnable task) {
        int running = inFlight.incrementAndGet();
        peak.accumulateAndGet(running, Math::max);
        try {
            task.run();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void awaitAll(List<Future<?>> futures) throws InterruptedException {
        Throwable first = null;
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    if (first == null) {
                        first = e.getCause();
                    } else {
                        first.addSuppressed(e.getCause());
                    }
                    break;
                }
            }
        }
        pending = false;
        if (first != null) {
            if (first instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException("Heavy worker failed", first);
        }
        if (interrupted) {
            throw new InterruptedException("Interrupted while awaiting heavy batch");
        }
    }

    @Override
    public int getConcurrency() {
        return slots;
    }

    /**
     * @return the highest number of tasks observed running at the same time since creation
     */
    public int getPeakConcurrency() {
        return peak.get();
    }

    /**
     * Stops accepting batches and waits up to five seconds for running tasks. Idempotent.
     */
    @Override
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
