package org.ysim.runtime.model;

/**
 * Resource class of an action, deciding which worker pool executes it.
 */
public enum ResourceClass {
    /** Content/graph service calls and bookkeeping only. Runs on the CPU pool. */
    LIGHT,
    /** Requires language-model inference. Runs on the fractional-resource pool. */
    HEAVY
}
