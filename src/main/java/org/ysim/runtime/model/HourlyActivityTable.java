package org.ysim.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Expected fraction of the live population active in each hour of the day.
 * <p>
 * Hours missing from the configured table have a fraction of 0 (nobody is ever sampled in
 * them). They stay detectable through {@link #missingHours()} so that a misconfigured
 * table can be reported rather than silently ignored. Read-only after construction.
 */
public final class HourlyActivityTable {

    private final double[] fractions;
    private final boolean[] defined;

    /**
     * @param slotsPerDay number of hours per simulated day
     * @param fractions   hour to fraction; hours must lie in {@code [0, slotsPerDay)} and
     *                    fractions in {@code [0, 1]}
     * @throws IllegalArgumentException if an hour or a fraction is out of range
     */
    public HourlyActivityTable(int slotsPerDay, Map<Integer, Double> fractions) {
        if (slotsPerDay <= 0) {
            throw new IllegalArgumentException("slotsPerDay must be > 0, got " + slotsPerDay);
        }
        this.fractions = new double[slotsPerDay];
        this.defined = new boolean[slotsPerDay];
        for (Map.Entry<Integer, Double> entry : fractions.entrySet()) {
            int hour = entry.getKey();
            double fraction = entry.getValue();
            if (hour < 0 || hour >= slotsPerDay) {
                throw new IllegalArgumentException("Hour " + hour + " is outside 0.." + (slotsPerDay - 1));
            }
            if (fraction < 0.0 || fraction > 1.0 || Double.isNaN(fraction)) {
                throw new IllegalArgumentException("Activity fraction for hour " + hour
                        + " must be within [0, 1], got " + fraction);
            }
            this.fractions[hour] = fraction;
            this.defined[hour] = true;
        }
    }

    /**
     * Creates a table where every hour has the same fraction.
     */
    public static HourlyActivityTable uniform(int slotsPerDay, double fraction) {
        Map<Integer, Double> all = new java.util.HashMap<>();
        for (int h = 0; h < slotsPerDay; h++) {
            all.put(h, fraction);
        }
        return new HourlyActivityTable(slotsPerDay, all);
    }

    public int slotsPerDay() {
        return fractions.length;
    }

    /**
     * @param hour hour of day
     * @return the configured fraction, or 0 if the hour is not in the table
     * @throws IllegalArgumentException if the hour is outside {@code [0, slotsPerDay)}
     */
    public double fraction(int hour) {
        if (hour < 0 || hour >= fractions.length) {
            throw new IllegalArgumentException("Hour " + hour + " is outside 0.." + (fractions.length - 1));
        }
        return fractions[hour];
    }

    public boolean isDefined(int hour) {
        return hour >= 0 && hour < defined.length && defined[hour];
    }

    /**
     * @return hours with no configured entry, in ascending order
     */
    public List<Integer> missingHours() {
        List<Integer> missing = new ArrayList<>();
        for (int h = 0; h < defined.length; h++) {
            if (!defined[h]) {
                missing.add(h);
            }
        }
        return Collections.unmodifiableList(missing);
    }
}
