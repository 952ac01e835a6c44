package org.ysim.client;

import org.ysim.runtime.config.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Content recommenders offered by the content service, selected by the {@code mode} request field.
 */
public enum ContentStrategy {
    DEFAULT("Default", "default"),
    REVERSE_CHRONO("ReverseChrono", "rchrono"),
    REVERSE_CHRONO_POPULARITY("ReverseChronoPopularity", "rchrono_popularity"),
    REVERSE_CHRONO_FOLLOWERS("ReverseChronoFollowers", "rchrono_followers"),
    REVERSE_CHRONO_FOLLOWERS_POPULARITY("ReverseChronoFollowersPopularity", "rchrono_followers_popularity"),
    REVERSE_CHRONO_COMMENTS("ReverseChronoComments", "rchrono_comments"),
    COMMON_INTERESTS("CommonInterests", "common_interests"),
    COMMON_USER_INTERESTS("CommonUserInterests", "common_user_interests"),
    SIMILAR_USERS_REACTIONS("SimilarUsersReactions", "similar_users"),
    SIMILAR_USERS_POSTS("SimilarUsersPosts", "similar_users_posts");

    private final String displayName;
    private final String mode;

    ContentStrategy(String displayName, String mode) {
        this.displayName = displayName;
        this.mode = mode;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return value of the server-side {@code mode} parameter
     */
    public String getMode() {
        return mode;
    }

    /**
     * Resolves a strategy by display name or mode, ignoring case.
     *
     * @throws ConfigurationException if no strategy matches
     */
    public static ContentStrategy fromName(String name) {
        String wanted = name == null ? "" : name.trim();
        for (ContentStrategy strategy : values()) {
            if (strategy.displayName.equalsIgnoreCase(wanted) || strategy.mode.equalsIgnoreCase(wanted)
                    || strategy.name().equals(wanted.toUpperCase(Locale.ROOT))) {
                return strategy;
            }
        }
        throw new ConfigurationException("Unknown content recommender '" + name + "', expected one of "
                + Arrays.stream(values()).map(ContentStrategy::getDisplayName).collect(Collectors.joining(", ")));
    }
}
