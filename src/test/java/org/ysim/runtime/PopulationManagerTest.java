package org.ysim.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.SimulationFixtures.InMemoryContentService;
import org.ysim.runtime.actions.ActionTable;
import org.ysim.runtime.config.SimulationSettings.DispatchSettings;
import org.ysim.runtime.config.SimulationSettings.PopulationSettings;
import org.ysim.runtime.config.SimulationSettings.RecruitmentBasis;
import org.ysim.runtime.dispatch.ActionInvoker;
import org.ysim.runtime.dispatch.Dispatcher;
import org.ysim.runtime.dispatch.TelemetryRecorder;
import org.ysim.runtime.internal.services.SeededRandomProvider;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.model.RateSpec;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.IActionHandler;

@Tag("unit")
class PopulationManagerTest {

    private static final SlotTime LAST_SLOT = SlotTime.of(23, 24);

    private Population population;
    private FollowGraph graph;
    private InMemoryContentService content;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        population = new Population();
        graph = new FollowGraph();
        content = new InMemoryContentService();
        for (int i = 0; i < 10; i++) {
            population.add(SimulationFixtures.user(i));
        }
        population.add(SimulationFixtures.page(10));
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
    }

    private PopulationManager manager(PopulationSettings settings, IActionHandler followHandler) {
        ActionInvoker invoker = new ActionInvoker(ActionTable.uniform(followHandler),
                SimulationFixtures.environment(content, population, graph), new SeededRandomProvider(3), 0,
                new TelemetryRecorder(false));
        dispatcher = Dispatcher.create(new DispatchSettings(DispatchSettings.Mode.SEQUENTIAL, 1, 0, 1.0, 0.25, 8,
                Duration.ofSeconds(1)), invoker, population);
        return new PopulationManager(settings, population, graph, dispatcher, content,
                new SimulationFixtures.SimpleActorFactory(), new SeededRandomProvider(3));
    }

    private static PopulationSettings settings(RateSpec churn, RateSpec recruitment, RecruitmentBasis basis,
                                               double followProbability) {
        return new PopulationSettings(churn, recruitment, basis, followProbability, false);
    }

    @Test
    void churnsFlooredShareOfUsersOnly() throws InterruptedException {
        PopulationManager manager = manager(settings(RateSpec.percentage(0.2), RateSpec.NONE,
                RecruitmentBasis.POPULATION, 0.0), ctx -> { });

        PopulationManager.DayReport report = manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(report.churned()).isEqualTo(2);
        assertThat(report.before()).isEqualTo(11);
        assertThat(report.after()).isEqualTo(9);
        assertThat(population.liveCount(ActorKind.USER)).isEqualTo(8);
        assertThat(population.isLive(10)).isTrue();
        assertThat(content.getChurned()).hasSize(2).allMatch(population::isRetired);
        assertThat(report.failures()).isEmpty();
    }

    @Test
    void churnRemovesFollowEdges() throws InterruptedException {
        for (int i = 1; i < 10; i++) {
            graph.addEdge(0, i);
            graph.addEdge(i, 0);
        }
        PopulationManager manager = manager(settings(RateSpec.fixed(10), RateSpec.NONE,
                RecruitmentBasis.POPULATION, 0.0), ctx -> { });

        manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void smallPercentageChurnsNobody() throws InterruptedException {
        PopulationManager manager = manager(settings(RateSpec.percentage(0.05), RateSpec.NONE,
                RecruitmentBasis.POPULATION, 0.0), ctx -> { });

        assertThat(manager.endOfDay(LAST_SLOT, Set.of()).churned()).isZero();
    }

    @Test
    void recruitsJoinNextDayAndAreNotChurnedToday() throws InterruptedException {
        PopulationManager manager = manager(settings(RateSpec.fixed(10), RateSpec.fixed(3),
                RecruitmentBasis.POPULATION, 0.0), ctx -> { });

        PopulationManager.DayReport report = manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(report.churned()).isEqualTo(10);
        assertThat(report.recruited()).isEqualTo(3);
        List<Actor> users = population.snapshotLive(ActorKind.USER);
        assertThat(users).extracting(Actor::getId).containsExactly(11L, 12L, 13L);
        assertThat(users).allMatch(actor -> actor.getJoinedDay() == 1);
        assertThat(content.getRegistered()).containsExactlyInAnyOrder(11L, 12L, 13L);
    }

    @Test
    void dailyActiveBasisCountsActiveUsers() throws InterruptedException {
        PopulationManager manager = manager(settings(RateSpec.NONE, RateSpec.percentage(0.5),
                RecruitmentBasis.DAILY_ACTIVE, 0.0), ctx -> { });

        assertThat(manager.endOfDay(LAST_SLOT, Set.of(1L, 2L, 3L, 4L)).recruited()).isEqualTo(2);
    }

    @Test
    void populationBasisUsesUsersLeftAfterChurn() throws InterruptedException {
        PopulationManager manager = manager(settings(RateSpec.fixed(4), RateSpec.percentage(0.5),
                RecruitmentBasis.POPULATION, 0.0), ctx -> { });

        PopulationManager.DayReport report = manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(report.recruited()).isEqualTo(3);
        assertThat(report.after()).isEqualTo(11 - 4 + 3);
    }

    @Test
    void followRunsBeforeChurnSoChurnedUsersWereValidTargets() throws InterruptedException {
        List<Boolean> targetsLiveDuringFollow = new CopyOnWriteArrayList<>();
        PopulationManager manager = manager(settings(RateSpec.fixed(10), RateSpec.NONE,
                RecruitmentBasis.POPULATION, 1.0), ctx -> {
                    targetsLiveDuringFollow.add(ctx.getEnvironment().getPopulation().isLive(0));
                    ctx.getEnvironment().getGraph().addEdge(ctx.getActor().getId(), ctx.getActor().getId() == 0 ? 1 : 0);
                });

        PopulationManager.DayReport report = manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(report.followResults()).hasSize(10);
        assertThat(targetsLiveDuringFollow).hasSize(10).containsOnly(true);
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void failingPhasesAreReportedAndLaterPhasesStillRun() throws InterruptedException {
        content.failChurnFor(0);
        content.failChurnFor(1);
        PopulationManager manager = manager(settings(RateSpec.fixed(10), RateSpec.fixed(2),
                RecruitmentBasis.POPULATION, 1.0), ctx -> {
                    throw new IllegalStateException("recommender down");
                });

        PopulationManager.DayReport report = manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(report.failures()).extracting(PopulationManager.PhaseFailure::phase)
                .containsExactly(PopulationManager.Phase.FOLLOW, PopulationManager.Phase.CHURN);
        assertThat(report.churned()).isEqualTo(10);
        assertThat(report.recruited()).isEqualTo(2);
        assertThat(population.isLive(0)).isFalse();
    }

    @Test
    void failedRegistrationSkipsRecruit() throws InterruptedException {
        content.failRegistration(true);
        PopulationManager manager = manager(settings(RateSpec.NONE, RateSpec.fixed(2),
                RecruitmentBasis.POPULATION, 0.0), ctx -> { });

        PopulationManager.DayReport report = manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(report.recruited()).isZero();
        assertThat(report.after()).isEqualTo(report.before());
        assertThat(report.failures()).extracting(PopulationManager.PhaseFailure::phase)
                .containsExactly(PopulationManager.Phase.RECRUIT);
    }

    @Test
    void followEvaluationCanBeLimitedToActiveUsers() throws InterruptedException {
        List<Long> evaluated = new CopyOnWriteArrayList<>();
        PopulationManager manager = manager(new PopulationSettings(RateSpec.NONE, RateSpec.NONE,
                RecruitmentBasis.POPULATION, 1.0, true), ctx -> evaluated.add(ctx.getActor().getId()));

        manager.endOfDay(LAST_SLOT, Set.of(2L, 5L));

        assertThat(evaluated).containsExactlyInAnyOrder(2L, 5L);
    }

    @Test
    void followEvaluationRunsAtTheBoundaryAfterTheLastSlot() throws InterruptedException {
        List<SlotTime> times = new CopyOnWriteArrayList<>();
        PopulationManager manager = manager(settings(RateSpec.NONE, RateSpec.NONE,
                RecruitmentBasis.POPULATION, 1.0), ctx -> times.add(ctx.getTime()));

        PopulationManager.DayReport report = manager.endOfDay(LAST_SLOT, Set.of());

        assertThat(times).hasSize(10).containsOnly(LAST_SLOT.boundaryAfter());
        assertThat(report.followResults()).allSatisfy(result -> {
            assertThat(result.boundary()).isTrue();
            assertThat(result.slot()).isEqualTo(LAST_SLOT.slot());
        });
    }
}
