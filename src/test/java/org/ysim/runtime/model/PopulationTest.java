package org.ysim.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.SimulationFixtures;

@Tag("unit")
class PopulationTest {

    @Test
    void churnRetiresIdForGood() {
        Population population = new Population();
        population.add(SimulationFixtures.user(0));
        population.add(SimulationFixtures.user(1));

        Actor churned = population.churn(0).orElseThrow();

        assertThat(churned.isLive()).isFalse();
        assertThat(churned.getState()).isEqualTo(LifecycleState.CHURNED);
        assertThat(population.isLive(0)).isFalse();
        assertThat(population.isRetired(0)).isTrue();
        assertThat(population.liveCount()).isEqualTo(1);
        assertThat(population.churn(0)).isEmpty();
        assertThatThrownBy(() -> population.add(SimulationFixtures.user(0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already in use");
    }

    @Test
    void nextIdSkipsEveryIdHandedOut() {
        Population population = new Population();
        population.add(SimulationFixtures.user(7));

        long first = population.nextActorId();
        long second = population.nextActorId();

        assertThat(first).isEqualTo(8);
        assertThat(second).isEqualTo(9);
    }

    @Test
    void snapshotsAreOrderedByIdAndFilterByKind() {
        Population population = new Population();
        population.add(SimulationFixtures.user(3));
        population.add(SimulationFixtures.page(1));
        population.add(SimulationFixtures.user(2));

        assertThat(population.snapshotLive()).extracting(Actor::getId).containsExactly(1L, 2L, 3L);
        assertThat(population.snapshotLive(ActorKind.USER)).extracting(Actor::getId).containsExactly(2L, 3L);
        assertThat(population.liveCount(ActorKind.PAGE)).isEqualTo(1);
    }

    @Test
    void duplicateLiveIdIsRejected() {
        Population population = new Population();
        population.add(SimulationFixtures.user(1));

        assertThatThrownBy(() -> population.add(SimulationFixtures.user(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
