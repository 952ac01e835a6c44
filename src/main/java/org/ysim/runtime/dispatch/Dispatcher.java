package org.ysim.runtime.dispatch;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.config.SimulationSettings.DispatchSettings;
import org.ysim.runtime.model.ActionIntent;
import org.ysim.runtime.model.ActionResult;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.model.SlotTime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Executes the action intents of one slot on two independent pools: light intents on the CPU
 * pool, heavy intents on the fractional-resource pool. Both pools run at the same time.
 * <p>
 * Heavy admission is decided before anything runs: the first {@code heavySlots + queueDepth}
 * heavy intents (in batch order) are admitted, the rest are recorded as
 * {@link org.ysim.runtime.model.ActionStatus#SKIPPED}. Because admission does not depend on
 * timing, the parallel and the sequential pool produce the same results.
 * <p>
 * Not thread-safe: {@link #dispatch} is called from the orchestration thread only.
 */
public class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final IWorkerPool lightPool;
    private final IWorkerPool heavyPool;
    private final int heavyAdmissionLimit;
    private final ActionInvoker invoker;
    private final Population population;

    /**
     * @param lightPool           pool for light intents
     * @param heavyPool           pool for heavy intents
     * @param heavyAdmissionLimit maximum number of heavy intents admitted per batch
     * @param invoker             per-intent middleware
     * @param population          lookup for the acting actors
     */
    public Dispatcher(IWorkerPool lightPool, IWorkerPool heavyPool, int heavyAdmissionLimit,
                      ActionInvoker invoker, Population population) {
        if (heavyAdmissionLimit < 1) {
            throw new IllegalArgumentException("heavyAdmissionLimit must be >= 1, got " + heavyAdmissionLimit);
        }
        this.lightPool = lightPool;
        this.heavyPool = heavyPool;
        this.heavyAdmissionLimit = heavyAdmissionLimit;
        this.invoker = invoker;
        this.population = population;
    }

    /**
     * Builds a dispatcher with the pools the settings ask for.
     * <p>
     * In parallel mode a light pool of fewer than two threads degrades to the sequential pool.
     * Admission of heavy intents follows the configured budget in both modes.
     */
    public static Dispatcher create(DispatchSettings settings, ActionInvoker invoker, Population population) {
        int heavySlots = FractionalResourcePool.slotsFor(settings.heavyCapacity(), settings.heavyUnit());
        int admission = heavySlots + settings.queueDepth();
        IWorkerPool light;
        IWorkerPool heavy;
        if (settings.mode() == DispatchSettings.Mode.SEQUENTIAL) {
            light = new SequentialWorkerPool();
            heavy = new SequentialWorkerPool();
        } else {
            int workers = resolveWorkers(settings.lightWorkers());
            light = workers > 1 ? new LightWorkerPool(workers) : new SequentialWorkerPool();
            heavy = new FractionalResourcePool(settings.heavyCapacity(), settings.heavyUnit());
        }
        LOG.info("Dispatcher: mode={}, light workers={}, heavy slots={} (capacity {} / unit {}), queue depth={}",
                settings.mode(), light.getConcurrency(), heavy.getConcurrency(),
                settings.heavyCapacity(), settings.heavyUnit(), settings.queueDepth());
        return new Dispatcher(light, heavy, admission, invoker, population);
    }

    /**
     * Resolves the configured light worker count.
     *
     * @param configured 0 = available processors, N = exactly N
     * @return the effective worker count (always &gt;= 1)
     */
    public static int resolveWorkers(int configured) {
        if (configured < 0) {
            throw new IllegalArgumentException("dispatch.light.workers must be >= 0, got " + configured);
        }
        if (configured == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors());
        }
        return configured;
    }

    /**
     * Executes a batch and waits until every intent has a result.
     *
     * @param time    the slot being executed
     * @param intents at most one intent per actor, all for {@code time}
     * @return one result per intent, in intent order
     * @throws IllegalArgumentException if an actor appears twice, an intent belongs to another
     *                                  slot, or an actor is not live
     * @throws InterruptedException     if the orchestration thread was interrupted while waiting;
     *                                  the batch has drained when this is thrown
     */
    public List<ActionResult> dispatch(SlotTime time, List<ActionIntent> intents) throws InterruptedException {
        Actor[] actors = resolve(time, intents);
        ActionResult[] results = new ActionResult[intents.size()];
        List<Runnable> heavy = new ArrayList<>();
        List<Runnable> light = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < intents.size(); i++) {
            int index = i;
            ActionIntent intent = intents.get(i);
            Actor actor = actors[i];
            if (intent.kind().isHeavy()) {
                if (heavy.size() >= heavyAdmissionLimit) {
                    results[i] = invoker.skip(time, actor, intent, "heavy queue full");
                    skipped++;
                    continue;
                }
                heavy.add(() -> results[index] = invoker.invoke(time, actor, intent));
            } else {
                light.add(() -> results[index] = invoker.invoke(time, actor, intent));
            }
        }
        if (skipped > 0) {
            LOG.warn("Heavy pool saturated at {}: {} of {} heavy intents skipped",
                    time, skipped, heavy.size() + skipped);
        }

        IWorkerPool.Batch heavyBatch = heavyPool.submit(heavy);
        IWorkerPool.Batch lightBatch;
        try {
            lightBatch = lightPool.submit(light);
        } catch (RuntimeException e) {
            drainAfterFailure(heavyBatch, e);
            throw e;
        }
        try {
            lightBatch.await();
        } catch (RuntimeException | InterruptedException e) {
            drainAfterFailure(heavyBatch, e);
            throw e;
        }
        heavyBatch.await();
        LOG.debug("Dispatched {} intents at {} ({} light, {} heavy, {} skipped)",
                intents.size(), time, light.size(), heavy.size(), skipped);
        return Arrays.asList(results);
    }

    /**
     * Waits for a batch while another failure is already on its way out; a failure of the batch
     * is attached to that one as suppressed.
     */
    private static void drainAfterFailure(IWorkerPool.Batch batch, Exception primary) {
        try {
            batch.await();
        } catch (InterruptedException e) {
            primary.addSuppressed(e);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            primary.addSuppressed(e);
        }
    }

    private Actor[] resolve(SlotTime time, List<ActionIntent> intents) {
        Actor[] actors = new Actor[intents.size()];
        LongOpenHashSet seen = new LongOpenHashSet(intents.size());
        for (int i = 0; i < intents.size(); i++) {
            ActionIntent intent = intents.get(i);
            if (intent.slot() != time.slot()) {
                throw new IllegalArgumentException("Intent " + intent + " does not belong to " + time);
            }
            if (!seen.add(intent.actorId())) {
                throw new IllegalArgumentException("Actor " + intent.actorId() + " has more than one intent at " + time);
            }
            actors[i] = population.find(intent.actorId())
                    .orElseThrow(() -> new IllegalArgumentException("Actor " + intent.actorId() + " is not live"));
        }
        return actors;
    }

    public int getHeavyAdmissionLimit() {
        return heavyAdmissionLimit;
    }

    public IWorkerPool getLightPool() {
        return lightPool;
    }

    public IWorkerPool getHeavyPool() {
        return heavyPool;
    }

    /**
     * Releases both pools. Idempotent.
     */
    public void shutdown() {
        lightPool.shutdown();
        heavyPool.shutdown();
    }
}
