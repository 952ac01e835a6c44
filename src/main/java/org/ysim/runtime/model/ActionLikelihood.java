package org.ysim.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Relative weights of the action kinds plus an optional weight for electing not to act.
 * <p>
 * Weights need not sum to one: they are normalized over the eligible subset at selection time.
 * Kinds that are absent or weighted zero are never selected. Instances are immutable.
 */
public final class ActionLikelihood {

    /** Configuration key for the "do nothing this slot" weight. */
    public static final String NONE_KEY = "none";

    private final EnumMap<ActionKind, Double> weights;
    private final double noneWeight;

    /**
     * @param weights    per-kind weights, each &gt;= 0
     * @param noneWeight weight of electing a no-op, &gt;= 0
     * @throws IllegalArgumentException if any weight is negative or not finite
     */
    public ActionLikelihood(Map<ActionKind, Double> weights, double noneWeight) {
        this.weights = new EnumMap<>(ActionKind.class);
        for (Map.Entry<ActionKind, Double> entry : weights.entrySet()) {
            double w = entry.getValue();
            if (w < 0.0 || !Double.isFinite(w)) {
                throw new IllegalArgumentException("Weight of " + entry.getKey().configKey()
                        + " must be a finite value >= 0, got " + w);
            }
            if (w > 0.0) {
                this.weights.put(entry.getKey(), w);
            }
        }
        if (noneWeight < 0.0 || !Double.isFinite(noneWeight)) {
            throw new IllegalArgumentException("Weight of none must be a finite value >= 0, got " + noneWeight);
        }
        this.noneWeight = noneWeight;
    }

    /**
     * Creates a distribution that always selects the given kind.
     */
    public static ActionLikelihood only(ActionKind kind) {
        return new ActionLikelihood(Map.of(kind, 1.0), 0.0);
    }

    public double weight(ActionKind kind) {
        return weights.getOrDefault(kind, 0.0);
    }

    public double noneWeight() {
        return noneWeight;
    }

    /**
     * @return an unmodifiable view of the strictly positive weights
     */
    public Map<ActionKind, Double> weights() {
        return Collections.unmodifiableMap(weights);
    }

    /**
     * Returns the normalized probability of a kind over all configured weights (including none).
     *
     * @param kind the action kind
     * @return probability in [0, 1], or 0 when nothing is configured
     */
    public double probability(ActionKind kind) {
        double total = noneWeight;
        for (double w : weights.values()) {
            total += w;
        }
        return total > 0.0 ? weight(kind) / total : 0.0;
    }

    /**
     * @return {@code true} if any selectable kind needs language-model inference
     */
    public boolean requiresInference() {
        for (ActionKind kind : weights.keySet()) {
            if (kind.isHeavy()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ActionLikelihood" + weights + (noneWeight > 0.0 ? " none=" + noneWeight : "");
    }
}
