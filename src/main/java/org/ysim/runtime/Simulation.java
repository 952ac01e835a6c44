package org.ysim.runtime;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.dispatch.Dispatcher;
import org.ysim.runtime.model.ActionIntent;
import org.ysim.runtime.model.ActionResult;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.IRandomProvider;
import org.ysim.runtime.spi.ISlotPlugin;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives the slot loop: for each slot, run the slot plugins, snapshot the live population,
 * sample the active actors, select their actions and dispatch them; after the last slot of a day
 * that has a successor, evolve the population.
 * <p>
 * A slot's batch fully drains, failures included, before the clock advances. Population changes
 * happen only between slots, so the snapshot taken at the start of a slot stays valid for the
 * whole slot. Not thread-safe: {@link #step()} and {@link #run()} belong to one orchestration thread.
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationClock clock;
    private final Population population;
    private final FollowGraph graph;
    private final ActivitySampler sampler;
    private final ActionSelector selector;
    private final Dispatcher dispatcher;
    private final PopulationManager populationManager;
    private final IRandomProvider randomProvider;
    private final RunSummary summary = new RunSummary();
    private final List<ISlotPlugin> slotPlugins = new ArrayList<>();
    private final List<Consumer<PopulationManager.DayReport>> dayListeners = new ArrayList<>();
    private final LongOpenHashSet dailyActive = new LongOpenHashSet();

    public Simulation(SimulationClock clock, Population population, FollowGraph graph, ActivitySampler sampler,
                      ActionSelector selector, Dispatcher dispatcher, PopulationManager populationManager,
                      IRandomProvider randomProvider) {
        this.clock = clock;
        this.population = population;
        this.graph = graph;
        this.sampler = sampler;
        this.selector = selector;
        this.dispatcher = dispatcher;
        this.populationManager = populationManager;
        this.randomProvider = randomProvider;
    }

    /**
     * Adds a plugin that runs at the start of every slot, in registration order.
     */
    public void addSlotPlugin(ISlotPlugin plugin) {
        slotPlugins.add(plugin);
    }

    /**
     * Registers a callback invoked with every day-boundary report.
     */
    public void addDayListener(Consumer<PopulationManager.DayReport> listener) {
        dayListeners.add(listener);
    }

    /**
     * Executes the current slot and advances the clock.
     *
     * @return {@code true} if another slot follows, {@code false} once the run is complete
     * @throws InterruptedException if interrupted while a batch was draining
     */
    public boolean step() throws InterruptedException {
        SlotTime time = clock.current();

        for (ISlotPlugin plugin : slotPlugins) {
            try {
                plugin.onSlot(this);
            } catch (Exception e) {
                LOG.warn("Slot plugin '{}' failed at {}: {}",
                        plugin.getClass().getSimpleName(), time, e.getMessage());
            }
        }

        List<Actor> live = population.snapshotLive();
        ActivitySampler.SlotSample sample = sampler.sample(time, live);
        for (Actor user : sample.activeUsers()) {
            dailyActive.add(user.getId());
        }
        List<ActionIntent> intents = selector.selectAll(sample);
        for (ActionIntent intent : intents) {
            sampler.recordAction(intent.actorId());
        }
        summary.recordIdle(time.day(), sample.size() - intents.size());

        List<ActionResult> results = dispatcher.dispatch(time, intents);
        summary.record(results);
        LOG.debug("{}: {} live, {} active, {} intents", time, live.size(), sample.size(), intents.size());

        if (clock.isLastSlotOfDay() && time.day() + 1 < clock.getTotalDays()) {
            PopulationManager.DayReport report = populationManager.endOfDay(time, dailyActive);
            summary.addDay(report);
            for (Consumer<PopulationManager.DayReport> listener : dayListeners) {
                listener.accept(report);
            }
        }
        if (clock.isLastSlotOfDay()) {
            dailyActive.clear();
        }
        return clock.advance();
    }

    /**
     * Runs slots until the clock is terminal.
     *
     * @return the summary of the run
     * @throws InterruptedException if the orchestration thread was interrupted; the current slot
     *                              has drained when this is thrown
     */
    public RunSummary run() throws InterruptedException {
        LOG.info("Simulation starting: {} days x {} slots, {} live actors",
                clock.getTotalDays(), clock.getSlotsPerDay(), population.liveCount());
        while (step()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Simulation interrupted");
            }
        }
        int[] totals = summary.totals();
        LOG.info("Simulation finished: {} succeeded, {} failed, {} skipped, {} live actors, {} follow edges",
                totals[0], totals[1], totals[2], population.liveCount(), graph.edgeCount());
        return summary;
    }

    /**
     * @return the slot about to run
     * @throws IllegalStateException if the run is complete
     */
    public SlotTime getCurrentTime() {
        return clock.current();
    }

    public SimulationClock getClock() {
        return clock;
    }

    public Population getPopulation() {
        return population;
    }

    public FollowGraph getGraph() {
        return graph;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    public RunSummary getSummary() {
        return summary;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Releases the dispatcher's worker threads. Safe to call multiple times.
     * Must not be called concurrently with {@link #step()}.
     */
    public void shutdown() {
        dispatcher.shutdown();
    }
}
