package org.ysim.client;

import org.ysim.runtime.config.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Link-prediction recommenders offered by the content service for follow suggestions.
 */
public enum FollowStrategy {
    RANDOM("Random", "random"),
    COMMON_NEIGHBORS("CommonNeighbors", "common_neighbors"),
    JACCARD("Jaccard", "jaccard"),
    ADAMIC_ADAR("AdamicAdar", "adamic_adar"),
    PREFERENTIAL_ATTACHMENT("PreferentialAttachment", "preferential_attachment");

    private final String displayName;
    private final String mode;

    FollowStrategy(String displayName, String mode) {
        this.displayName = displayName;
        this.mode = mode;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getMode() {
        return mode;
    }

    /**
     * Resolves a strategy by display name or mode, ignoring case.
     *
     * @throws ConfigurationException if no strategy matches
     */
    public static FollowStrategy fromName(String name) {
        String wanted = name == null ? "" : name.trim();
        for (FollowStrategy strategy : values()) {
            if (strategy.displayName.equalsIgnoreCase(wanted) || strategy.mode.equalsIgnoreCase(wanted)
                    || strategy.name().equals(wanted.toUpperCase(Locale.ROOT))) {
                return strategy;
            }
        }
        throw new ConfigurationException("Unknown follow recommender '" + name + "', expected one of "
                + Arrays.stream(values()).map(FollowStrategy::getDisplayName).collect(Collectors.joining(", ")));
    }
}
