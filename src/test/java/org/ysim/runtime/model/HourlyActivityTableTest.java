package org.ysim.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class HourlyActivityTableTest {

    @Test
    void missingHoursHaveZeroFractionAndAreReported() {
        HourlyActivityTable table = new HourlyActivityTable(4, Map.of(0, 0.5, 2, 0.25));

        assertThat(table.fraction(0)).isEqualTo(0.5);
        assertThat(table.fraction(1)).isZero();
        assertThat(table.isDefined(1)).isFalse();
        assertThat(table.missingHours()).containsExactly(1, 3);
    }

    @Test
    void outOfRangeEntriesAreRejected() {
        assertThatThrownBy(() -> new HourlyActivityTable(24, Map.of(24, 0.1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Hour 24");
        assertThatThrownBy(() -> new HourlyActivityTable(24, Map.of(3, 1.2)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HourlyActivityTable.uniform(4, 0.5).fraction(4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uniformDefinesEveryHour() {
        HourlyActivityTable table = HourlyActivityTable.uniform(24, 0.1);

        assertThat(table.slotsPerDay()).isEqualTo(24);
        assertThat(table.missingHours()).isEmpty();
        assertThat(table.fraction(23)).isEqualTo(0.1);
    }
}
