package org.ysim.runtime.model;

/**
 * Outcome of a single action execution.
 */
public enum ActionStatus {
    SUCCEEDED,
    FAILED,
    /** The external call exceeded the per-action timeout. Counted as a failure in summaries. */
    TIMED_OUT,
    /** Not admitted by the heavy pool because its queue was full. Never executed. */
    SKIPPED;

    /**
     * @return {@code true} for both plain failures and timeouts.
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
