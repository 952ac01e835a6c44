package org.ysim.runtime.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of actions an actor may attempt in a slot.
 * <p>
 * Every kind carries its resource class (which pool runs it), whether it may be retried
 * after a transient failure, the actor kinds allowed to select it, and the key used for
 * it in configuration ({@code simulation.actions-likelihood}, {@code pages.actions-likelihood}).
 */
public enum ActionKind {
    POST(ResourceClass.HEAVY, false, EnumSet.of(ActorKind.USER, ActorKind.PAGE)),
    COMMENT(ResourceClass.HEAVY, false, EnumSet.of(ActorKind.USER)),
    READ(ResourceClass.LIGHT, true, EnumSet.of(ActorKind.USER)),
    SHARE(ResourceClass.HEAVY, false, EnumSet.of(ActorKind.USER, ActorKind.PAGE)),
    REPLY(ResourceClass.HEAVY, false, EnumSet.of(ActorKind.USER)),
    SEARCH(ResourceClass.LIGHT, true, EnumSet.of(ActorKind.USER)),
    FOLLOW(ResourceClass.LIGHT, true, EnumSet.of(ActorKind.USER)),
    CAST(ResourceClass.HEAVY, false, EnumSet.of(ActorKind.USER)),
    REACT(ResourceClass.HEAVY, false, EnumSet.of(ActorKind.USER)),
    NEWS(ResourceClass.HEAVY, false, EnumSet.of(ActorKind.PAGE));

    private final ResourceClass resourceClass;
    private final boolean idempotent;
    private final Set<ActorKind> allowedFor;

    ActionKind(ResourceClass resourceClass, boolean idempotent, Set<ActorKind> allowedFor) {
        this.resourceClass = resourceClass;
        this.idempotent = idempotent;
        this.allowedFor = allowedFor;
    }

    public ResourceClass resourceClass() {
        return resourceClass;
    }

    public boolean isHeavy() {
        return resourceClass == ResourceClass.HEAVY;
    }

    /**
     * Idempotent actions are the only ones retried after a transient gateway failure.
     *
     * @return {@code true} if repeating the action has no additional effect
     */
    public boolean isIdempotent() {
        return idempotent;
    }

    public boolean isAllowedFor(ActorKind kind) {
        return allowedFor.contains(kind);
    }

    /**
     * @return the lower-case configuration key, e.g. {@code "post"}
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up an action by its configuration key (case-insensitive).
     *
     * @param key the key, e.g. {@code "comment"}
     * @return the action kind, or empty if the key names no action
     */
    public static Optional<ActionKind> fromConfigKey(String key) {
        for (ActionKind kind : values()) {
            if (kind.configKey().equalsIgnoreCase(key.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
