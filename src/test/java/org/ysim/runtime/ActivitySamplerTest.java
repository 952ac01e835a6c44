package org.ysim.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.internal.services.SeededRandomProvider;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.HourlyActivityTable;
import org.ysim.runtime.model.SlotTime;

@Tag("unit")
class ActivitySamplerTest {

    private static List<Actor> users(int count) {
        List<Actor> users = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            users.add(SimulationFixtures.user(i));
        }
        return users;
    }

    @Test
    void fullHourActivatesEveryoneAndEmptyHoursNobody() {
        HourlyActivityTable table = new HourlyActivityTable(4, Map.of(0, 1.0, 1, 0.0, 2, 0.0, 3, 0.0));
        ActivitySampler sampler = new ActivitySampler(table, null, new SeededRandomProvider(1));
        List<Actor> live = users(5);

        assertThat(sampler.sample(SlotTime.of(0, 4), live).activeUsers()).hasSize(5);
        for (int slot = 1; slot < 4; slot++) {
            assertThat(sampler.sample(SlotTime.of(slot, 4), live).activeUsers()).isEmpty();
        }
    }

    @Test
    void activeShareConvergesToFraction() {
        ActivitySampler sampler = new ActivitySampler(HourlyActivityTable.uniform(24, 0.3), null,
                new SeededRandomProvider(11));
        List<Actor> live = users(200);

        long active = 0;
        for (int slot = 0; slot < 240; slot++) {
            active += sampler.sample(SlotTime.of(slot, 24), live).activeUsers().size();
        }

        assertThat(active / (200.0 * 240)).isCloseTo(0.3, org.assertj.core.data.Offset.offset(0.01));
    }

    @Test
    void sameSeedGivesSameSample() {
        List<Actor> live = users(50);
        HourlyActivityTable table = HourlyActivityTable.uniform(24, 0.5);
        ActivitySampler first = new ActivitySampler(table, null, new SeededRandomProvider(3));
        ActivitySampler second = new ActivitySampler(table, null, new SeededRandomProvider(3));

        for (int slot = 0; slot < 24; slot++) {
            SlotTime time = SlotTime.of(slot, 24);
            assertThat(first.sample(time, live).activeUsers())
                    .isEqualTo(second.sample(time, live).activeUsers());
        }
    }

    @Test
    void roundActionsCapActionsPerDay() {
        ActivitySampler sampler = new ActivitySampler(HourlyActivityTable.uniform(4, 1.0), null,
                new SeededRandomProvider(5));
        List<Actor> live = List.of(SimulationFixtures.user(0, 2, 1.0), SimulationFixtures.user(1, 0, 1.0));

        int cappedActive = 0;
        for (int slot = 0; slot < 4; slot++) {
            for (Actor actor : sampler.sample(SlotTime.of(slot, 4), live).activeUsers()) {
                sampler.recordAction(actor.getId());
                if (actor.getId() == 0) {
                    cappedActive++;
                }
            }
        }
        assertThat(cappedActive).isEqualTo(2);
        assertThat(sampler.actionsToday(0)).isEqualTo(2);

        // Next day resets the budget.
        assertThat(sampler.sample(SlotTime.of(4, 4), live).activeUsers()).hasSize(2);
        assertThat(sampler.actionsToday(0)).isZero();
    }

    @Test
    void slotWithoutActionKeepsBudget() {
        ActivitySampler sampler = new ActivitySampler(HourlyActivityTable.uniform(4, 1.0), null,
                new SeededRandomProvider(5));
        List<Actor> live = List.of(SimulationFixtures.user(0, 1, 1.0));

        assertThat(sampler.sample(SlotTime.of(0, 4), live).activeUsers()).hasSize(1);
        assertThat(sampler.actionsToday(0)).isZero();

        assertThat(sampler.sample(SlotTime.of(1, 4), live).activeUsers()).hasSize(1);
        sampler.recordAction(0);
        assertThat(sampler.sample(SlotTime.of(2, 4), live).activeUsers()).isEmpty();
    }

    @Test
    void zeroActivityScaleNeverActivates() {
        ActivitySampler sampler = new ActivitySampler(HourlyActivityTable.uniform(4, 1.0), null,
                new SeededRandomProvider(5));
        List<Actor> live = List.of(SimulationFixtures.user(0, 0, 0.0));

        assertThat(sampler.sample(SlotTime.of(0, 4), live).activeUsers()).isEmpty();
    }

    @Test
    void pagesPublishEverySlotWithoutPageTable() {
        ActivitySampler sampler = new ActivitySampler(HourlyActivityTable.uniform(4, 0.0), null,
                new SeededRandomProvider(5));
        List<Actor> live = List.of(SimulationFixtures.user(0), SimulationFixtures.page(1));

        ActivitySampler.SlotSample sample = sampler.sample(SlotTime.of(2, 4), live);

        assertThat(sample.activeUsers()).isEmpty();
        assertThat(sample.publishingPages()).extracting(Actor::getId).containsExactly(1L);
    }

    @Test
    void pageTableGatesPages() {
        ActivitySampler sampler = new ActivitySampler(HourlyActivityTable.uniform(4, 1.0),
                HourlyActivityTable.uniform(4, 0.0), new SeededRandomProvider(5));

        assertThat(sampler.sample(SlotTime.of(0, 4), List.of(SimulationFixtures.page(1))).publishingPages())
                .isEmpty();
    }
}
