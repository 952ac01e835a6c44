package org.ysim.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.config.SimulationSettings.PopulationSettings;
import org.ysim.runtime.config.SimulationSettings.RecruitmentBasis;
import org.ysim.runtime.dispatch.Dispatcher;
import org.ysim.runtime.model.ActionIntent;
import org.ysim.runtime.model.ActionKind;
import org.ysim.runtime.model.ActionResult;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IActorFactory;
import org.ysim.runtime.spi.IContentService;
import org.ysim.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Evolves the population and the follow graph at a day boundary, in three fixed phases:
 * follow evaluation, churn, recruitment.
 * <p>
 * The order guarantees that a user churned today was still a valid follow target during today's
 * evaluation and that a user recruited today cannot be drawn for today's churn. A failing phase is
 * recorded in the {@link DayReport} and the remaining phases still run. Pages take part in none of
 * the phases.
 */
public class PopulationManager {

    private static final Logger LOG = LoggerFactory.getLogger(PopulationManager.class);

    public enum Phase {
        FOLLOW,
        CHURN,
        RECRUIT
    }

    /**
     * A day-boundary phase that did not complete cleanly.
     */
    public record PhaseFailure(int day, Phase phase, String message) {
    }

    /**
     * What happened at one day boundary.
     *
     * @param day           the day that just ended
     * @param before        live actors before the phases
     * @param churned       actors removed
     * @param recruited     actors added
     * @param after         live actors after the phases; always {@code before - churned + recruited}
     * @param followResults results of the follow evaluations
     * @param failures      phases that did not complete cleanly
     */
    public record DayReport(int day, int before, int churned, int recruited, int after,
                            List<ActionResult> followResults, List<PhaseFailure> failures) {
    }

    private final PopulationSettings settings;
    private final Population population;
    private final FollowGraph graph;
    private final Dispatcher dispatcher;
    private final IContentService content;
    private final IActorFactory factory;
    private final IRandomProvider random;

    public PopulationManager(PopulationSettings settings, Population population, FollowGraph graph,
                             Dispatcher dispatcher, IContentService content, IActorFactory factory,
                             IRandomProvider random) {
        this.settings = settings;
        this.population = population;
        this.graph = graph;
        this.dispatcher = dispatcher;
        this.content = content;
        this.factory = factory;
        this.random = random;
    }

    /**
     * Runs the three phases after the last slot of a day has completed.
     *
     * @param lastSlot    the last slot of the ending day; follow evaluations run at the boundary
     *                    after it, never in the slot itself
     * @param dailyActive ids of users that were active at least once during the day
     * @return the report of the boundary
     * @throws InterruptedException if interrupted while follow evaluations were running
     */
    public DayReport endOfDay(SlotTime lastSlot, Set<Long> dailyActive) throws InterruptedException {
        int day = lastSlot.day();
        int before = population.liveCount();
        List<PhaseFailure> failures = new ArrayList<>();

        List<ActionResult> followResults = evaluateFollows(lastSlot.boundaryAfter(), dailyActive, failures);
        int churned = churn(lastSlot, failures);
        int recruited = recruit(lastSlot, dailyActive, failures);

        int after = population.liveCount();
        if (after != before - churned + recruited) {
            throw new IllegalStateException("Population accounting broken on day " + day + ": " + before
                    + " - " + churned + " + " + recruited + " != " + after);
        }
        LOG.info("Day {} closed: {} follow evaluations, {} churned, {} recruited, population {} -> {}",
                day, followResults.size(), churned, recruited, before, after);
        return new DayReport(day, before, churned, recruited, after, followResults, List.copyOf(failures));
    }

    private List<ActionResult> evaluateFollows(SlotTime time, Set<Long> dailyActive, List<PhaseFailure> failures)
            throws InterruptedException {
        double probability = settings.dailyFollowProbability();
        if (probability <= 0.0) {
            return List.of();
        }
        IRandomProvider rng = random.deriveFor("follow", time.day());
        List<ActionIntent> intents = new ArrayList<>();
        for (Actor user : population.snapshotLive(ActorKind.USER)) {
            if (settings.followActiveOnly() && !dailyActive.contains(user.getId())) {
                continue;
            }
            if (rng.nextDouble() < probability) {
                intents.add(ActionIntent.of(user.getId(), time.slot(), ActionKind.FOLLOW));
            }
        }
        try {
            List<ActionResult> results = dispatcher.dispatch(time, intents);
            long failed = results.stream().filter(r -> r.status().isFailure()).count();
            if (failed > 0) {
                failures.add(new PhaseFailure(time.day(), Phase.FOLLOW,
                        failed + " of " + results.size() + " follow evaluations failed"));
            }
            return results;
        } catch (RuntimeException e) {
            LOG.warn("Follow evaluation failed on day {}: {}", time.day(), e.getMessage());
            failures.add(new PhaseFailure(time.day(), Phase.FOLLOW, e.toString()));
            return List.of();
        }
    }

    private int churn(SlotTime time, List<PhaseFailure> failures) {
        List<Actor> users = new ArrayList<>(population.snapshotLive(ActorKind.USER));
        int count = Math.min(settings.churn().count(users.size()), users.size());
        if (count == 0) {
            return 0;
        }
        Collections.shuffle(users, random.deriveFor("churn", time.day()).asJavaRandom());
        int churned = 0;
        int remoteFailures = 0;
        for (Actor user : users.subList(0, count)) {
            try {
                content.churn(user.getId(), time);
            } catch (GatewayException | RuntimeException e) {
                remoteFailures++;
                LOG.warn("Content service did not accept churn of {}: {}", user, e.getMessage());
            }
            if (population.churn(user.getId()).isPresent()) {
                graph.removeActor(user.getId());
                churned++;
            }
        }
        if (remoteFailures > 0) {
            failures.add(new PhaseFailure(time.day(), Phase.CHURN,
                    remoteFailures + " of " + count + " churn notifications failed"));
        }
        return churned;
    }

    private int recruit(SlotTime time, Set<Long> dailyActive, List<PhaseFailure> failures) {
        int base = settings.recruitmentBasis() == RecruitmentBasis.DAILY_ACTIVE
                ? dailyActive.size()
                : population.liveCount(ActorKind.USER);
        int count = settings.recruitment().count(base);
        int joinedDay = time.day() + 1;
        int recruited = 0;
        int skipped = 0;
        for (int i = 0; i < count; i++) {
            long id = population.nextActorId();
            try {
                Actor actor = factory.createUser(id, joinedDay, random.deriveFor("recruit", id));
                content.register(actor, joinedDay);
                population.add(actor);
                recruited++;
            } catch (GatewayException | RuntimeException e) {
                skipped++;
                LOG.warn("Recruit {} skipped: {}", id, e.getMessage());
            }
        }
        if (skipped > 0) {
            failures.add(new PhaseFailure(time.day(), Phase.RECRUIT,
                    skipped + " of " + count + " recruits could not be registered"));
        }
        return recruited;
    }
}
