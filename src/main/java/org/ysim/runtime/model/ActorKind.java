package org.ysim.runtime.model;

/**
 * The two kinds of actors taking part in a simulation.
 */
public enum ActorKind {
    /** An individual user agent. */
    USER,
    /** A content-publishing page (news outlet, feed). Pages publish and never churn. */
    PAGE
}
