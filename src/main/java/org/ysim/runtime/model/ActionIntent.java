package org.ysim.runtime.model;

import java.util.Objects;

/**
 * One action an actor will attempt in a slot. Produced by the selector, consumed by the
 * dispatcher, never kept beyond the slot.
 *
 * @param actorId   the acting actor
 * @param slot      absolute slot index
 * @param kind      the action to perform
 * @param targetRef optional post or user id the action is aimed at, {@code null} when the
 *                  handler resolves its own target
 */
public record ActionIntent(long actorId, long slot, ActionKind kind, Long targetRef) {

    public ActionIntent {
        Objects.requireNonNull(kind, "kind");
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be >= 0, got " + slot);
        }
    }

    public static ActionIntent of(long actorId, long slot, ActionKind kind) {
        return new ActionIntent(actorId, slot, kind, null);
    }

    public ResourceClass resourceClass() {
        return kind.resourceClass();
    }
}
