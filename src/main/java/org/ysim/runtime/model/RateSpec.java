package org.ysim.runtime.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A per-day population rate: either a fixed count or a fraction of a base population.
 * <p>
 * Percentage counts are floored, so {@code 0.2} of {@code 10} is {@code 2} and {@code 0.05} of
 * {@code 10} is {@code 0}. There is no minimum of one.
 *
 * @param mode  fixed count or percentage
 * @param value the count (a non-negative whole number) or the fraction in {@code [0, 1]}
 */
public record RateSpec(Mode mode, double value) {

    public enum Mode {
        FIXED,
        PERCENTAGE;

        public static Mode parse(String text) {
            return switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "fixed" -> FIXED;
                case "percentage" -> PERCENTAGE;
                default -> throw new IllegalArgumentException("Unknown rate mode '" + text
                        + "' (expected fixed or percentage)");
            };
        }
    }

    public static final RateSpec NONE = new RateSpec(Mode.FIXED, 0);

    public RateSpec {
        Objects.requireNonNull(mode, "mode");
        if (value < 0.0 || !Double.isFinite(value)) {
            throw new IllegalArgumentException("Rate value must be a finite value >= 0, got " + value);
        }
        if (mode == Mode.FIXED && value != Math.floor(value)) {
            throw new IllegalArgumentException("Fixed rate must be a whole number, got " + value);
        }
        if (mode == Mode.PERCENTAGE && value > 1.0) {
            throw new IllegalArgumentException("Percentage rate must be within [0, 1], got " + value);
        }
    }

    public static RateSpec fixed(int count) {
        return new RateSpec(Mode.FIXED, count);
    }

    public static RateSpec percentage(double fraction) {
        return new RateSpec(Mode.PERCENTAGE, fraction);
    }

    /**
     * Computes the count for a given base population.
     *
     * @param base population the rate applies to, ignored for fixed rates
     * @return the number of actors, never negative
     */
    public int count(int base) {
        if (mode == Mode.FIXED) {
            return (int) value;
        }
        // 1e-9 keeps 0.2 * 10 from flooring to 1 because of binary representation.
        return (int) Math.floor(value * Math.max(0, base) + 1e-9);
    }

    public boolean isDisabled() {
        return value == 0.0;
    }

    @Override
    public String toString() {
        return mode == Mode.FIXED ? ((int) value) + " per day" : (value * 100.0) + "% per day";
    }
}
