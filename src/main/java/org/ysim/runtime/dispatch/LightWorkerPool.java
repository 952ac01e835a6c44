package org.ysim.runtime.dispatch;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * CPU worker pool for light actions, kept alive across slots.
 * <p>
 * The pool keeps {@code P-1} daemon threads permanently alive between batches, parked with
 * {@link LockSupport#park()}. The thread that awaits a batch participates as worker 0, so the
 * total parallelism is P threads. Tasks are claimed one at a time from a shared index, so a
 * slow external call on one worker does not hold back the tasks queued behind it.
 * <p>
 * <b>Synchronization protocol:</b>
 * <ol>
 *   <li>{@link #submit} publishes the tasks, increments the volatile {@code phase} counter and
 *       unparks all workers</li>
 *   <li>Workers wake, read the new phase, claim and run tasks until none are left, then
 *       increment {@code workersCompleted}; the last one unparks the waiting thread</li>
 *   <li>{@link Batch#await()} claims tasks on the calling thread, then parks until all workers
 *       have acknowledged completion</li>
 * </ol>
 * <p>
 * <b>Thread safety:</b> {@link #submit} and {@link Batch#await()} must be called from the
 * orchestration thread only, one batch at a time. {@link #shutdown()} is idempotent and safe to
 * call from any thread.
 */
public class LightWorkerPool implements IWorkerPool {

    private final Thread[] workers;
    private final int totalThreads;

    private volatile int phase;
    private volatile List<? extends Runnable> tasks = List.of();
    private volatile boolean stopped;
    private volatile boolean pending;
    private volatile Thread waiter;
    private final AtomicInteger nextTask = new AtomicInteger();
    private final AtomicInteger workersCompleted = new AtomicInteger();
    private final AtomicReference<Throwable> workerException = new AtomicReference<>();

    private final AtomicInteger readyWorkers = new AtomicInteger();

    /**
     * Creates a new pool with the specified parallelism.
     * <p>
     * Spawns {@code parallelism - 1} daemon threads and waits until all have read their initial
     * phase snapshot. This startup barrier prevents a race where {@link #submit} could increment
     * {@code phase} before a worker has read it, causing the worker to treat the first batch as
     * a spurious wakeup.
     *
     * @param parallelism total number of threads (including the awaiting thread). Must be &gt;= 2.
     * @throws IllegalArgumentException if parallelism &lt; 2
     */
    public LightWorkerPool(int parallelism) {
        if (parallelism < 2) {
            throw new IllegalArgumentException("Parallelism must be >= 2, got " + parallelism);
        }
        this.totalThreads = parallelism;
        this.workers = new Thread[parallelism - 1];

        for (int i = 0; i < workers.length; i++) {
            int workerIndex = i + 1;
            workers[i] = new Thread(this::workerLoop, "light-worker-" + workerIndex);
            workers[i].setDaemon(true);
            workers[i].start();
        }

        while (readyWorkers.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    @Override
    public Batch submit(List<? extends Runnable> batch) {
        if (stopped) {
            throw new IllegalStateException("Pool has been shut down");
        }
        if (pending) {
            throw new IllegalStateException("Previous batch has not been awaited");
        }
        if (batch.isEmpty()) {
            return DONE;
        }
        this.tasks = batch;
        this.waiter = Thread.currentThread();
        nextTask.set(0);
        workerException.set(null);
        workersCompleted.set(0);
        pending = true;

        // Volatile write: happens-before for all workers reading phase
        phase++;

        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        return this::awaitBatch;
    }

    private void awaitBatch() throws InterruptedException {
        Throwable mainException = null;
        try {
            drain();
        } catch (Throwable t) {
            mainException = t;
        }

        boolean interrupted = false;
        while (workersCompleted.get() < workers.length) {
            LockSupport.park(this);
            if (Thread.interrupted()) {
                interrupted = true;
            }
        }
        pending = false;
        tasks = List.of();

        Throwable workerEx = workerException.get();
        if (workerEx != null) {
            if (mainException != null) {
                workerEx.addSuppressed(mainException);
            }
            throw propagate(workerEx, "Light worker failed");
        }
        if (mainException != null) {
            throw propagate(mainException, "Awaiting thread failed while draining the batch");
        }
        if (interrupted) {
            throw new InterruptedException("Interrupted while awaiting light batch");
        }
    }

    private void drain() {
        List<? extends Runnable> batch = tasks;
        int size = batch.size();
        for (int i = nextTask.getAndIncrement(); i < size; i = nextTask.getAndIncrement()) {
            batch.get(i).run();
        }
    }

    private static RuntimeException propagate(Throwable t, String message) {
        if (t instanceof RuntimeException re) {
            return re;
        }
        return new RuntimeException(message, t);
    }

    @Override
    public int getConcurrency() {
        return totalThreads;
    }

    /**
     * Shuts down the pool, interrupting and joining all worker threads.
     * <p>
     * Idempotent. Blocks until all workers have terminated or the join timeout (5 seconds per
     * thread) expires.
     */
    @Override
    public void shutdown() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * The main loop executed by each worker thread.
     * <p>
     * Workers park between batches and wake when {@link #submit} increments the phase counter.
     * Spurious wakeups are handled by comparing the local phase snapshot with the current phase.
     */
    private void workerLoop() {
        int lastPhase = phase;
        readyWorkers.incrementAndGet();

        while (!stopped) {
            LockSupport.park();

            if (stopped) break;

            int currentPhase = phase;
            if (currentPhase == lastPhase) {
                // Spurious wakeup
                continue;
            }
            lastPhase = currentPhase;

            try {
                drain();
            } catch (Throwable t) {
                workerException.compareAndSet(null, t);
            }

            if (workersCompleted.incrementAndGet() == workers.length) {
                LockSupport.unpark(waiter);
            }
        }
    }
}
