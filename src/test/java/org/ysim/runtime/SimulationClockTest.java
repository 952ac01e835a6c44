package org.ysim.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.model.SlotTime;

@Tag("unit")
class SimulationClockTest {

    @Test
    void walksEverySlotOnceThenTerminates() {
        SimulationClock clock = new SimulationClock(3, 2);
        List<SlotTime> seen = new ArrayList<>();

        do {
            seen.add(clock.current());
        } while (clock.advance());

        assertThat(seen).containsExactly(
                new SlotTime(0, 0, 0), new SlotTime(1, 0, 1), new SlotTime(2, 0, 2),
                new SlotTime(3, 1, 0), new SlotTime(4, 1, 1), new SlotTime(5, 1, 2));
        assertThat(clock.isTerminal()).isTrue();
        assertThat(clock.advance()).isFalse();
        assertThatThrownBy(clock::current).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void detectsLastSlotOfDay() {
        SimulationClock clock = new SimulationClock(2, 3, 2);

        assertThat(clock.isLastSlotOfDay()).isFalse();
        clock.advance();
        assertThat(clock.isLastSlotOfDay()).isTrue();
        assertThat(clock.current().day()).isEqualTo(1);
    }

    @Test
    void rejectsInvalidShapes() {
        assertThatThrownBy(() -> new SimulationClock(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SimulationClock(24, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SimulationClock(24, 1, 24)).isInstanceOf(IllegalArgumentException.class);
    }
}
