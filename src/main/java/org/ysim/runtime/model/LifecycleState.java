package org.ysim.runtime.model;

/**
 * Lifecycle of an actor within the live population.
 */
public enum LifecycleState {
    ACTIVE,
    CHURNED
}
