package org.ysim.runtime.model;

import java.util.Objects;

/**
 * Outcome of one action execution, as recorded by the dispatcher middleware.
 *
 * @param actorId        the acting actor
 * @param actorName      the actor's name (for telemetry)
 * @param kind           the action kind
 * @param slot           absolute slot index
 * @param day            day of the slot
 * @param hour           hour of the slot
 * @param boundary       {@code true} for work done at the day boundary after the slot
 * @param status         terminal status
 * @param durationNanos  wall-clock time spent, including retries
 * @param attempts       number of attempts made (0 for skipped actions)
 * @param error          error description for failed actions, {@code null} otherwise
 */
public record ActionResult(
        long actorId,
        String actorName,
        ActionKind kind,
        long slot,
        int day,
        int hour,
        boolean boundary,
        ActionStatus status,
        long durationNanos,
        int attempts,
        String error) {

    public ActionResult {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
    }

    public static ActionResult succeeded(Actor actor, ActionKind kind, SlotTime time, long durationNanos, int attempts) {
        return new ActionResult(actor.getId(), actor.getName(), kind, time.slot(), time.day(), time.hour(),
                time.boundary(), ActionStatus.SUCCEEDED, durationNanos, attempts, null);
    }

    public static ActionResult failed(Actor actor, ActionKind kind, SlotTime time, ActionStatus status,
                                      long durationNanos, int attempts, Throwable cause) {
        if (!status.isFailure()) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        return new ActionResult(actor.getId(), actor.getName(), kind, time.slot(), time.day(), time.hour(),
                time.boundary(), status, durationNanos, attempts, describe(cause));
    }

    public static ActionResult skipped(Actor actor, ActionKind kind, SlotTime time, String reason) {
        return new ActionResult(actor.getId(), actor.getName(), kind, time.slot(), time.day(), time.hour(),
                time.boundary(), ActionStatus.SKIPPED, 0L, 0, reason);
    }

    public boolean isSuccess() {
        return status == ActionStatus.SUCCEEDED;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return null;
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : cause.getClass().getSimpleName() + ": " + message;
    }
}
