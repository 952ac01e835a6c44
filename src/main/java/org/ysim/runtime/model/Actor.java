package org.ysim.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * A simulated actor: a user agent or a content-publishing page.
 * <p>
 * Identity, kind and profile are immutable. The mutable fields are owned by the actor: they
 * are written only while one of its own actions executes (at most one per slot) or, for the
 * lifecycle state, by the population manager at a day boundary. They are volatile because the
 * executing worker thread differs from slot to slot.
 */
public final class Actor {

    private final long id;
    private final String name;
    private final ActorKind kind;
    private final ActorProfile profile;
    private final int roundActions;
    private final double activityScale;
    private final ActionLikelihood likelihood;
    private final int joinedDay;

    private volatile LifecycleState state = LifecycleState.ACTIVE;
    private volatile long lastActiveSlot = -1L;
    private volatile int pendingMentions;
    private volatile int lastCastDay = -1;
    private volatile List<String> interests;

    /**
     * @param id            unique id, doubles as the content-service user id
     * @param name          unique display name
     * @param kind          user or page
     * @param profile       profile attributes
     * @param roundActions  maximum number of active slots per day, 0 for unbounded
     * @param activityScale personal multiplier applied to the hourly activity fraction
     * @param likelihood    personal action distribution, or {@code null} to use the global one
     * @param joinedDay     day the actor entered the population
     */
    public Actor(long id, String name, ActorKind kind, ActorProfile profile, int roundActions,
                 double activityScale, ActionLikelihood likelihood, int joinedDay) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got " + id);
        }
        if (roundActions < 0) {
            throw new IllegalArgumentException("roundActions must be >= 0, got " + roundActions);
        }
        if (activityScale < 0.0 || !Double.isFinite(activityScale)) {
            throw new IllegalArgumentException("activityScale must be a finite value >= 0, got " + activityScale);
        }
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.roundActions = roundActions;
        this.activityScale = activityScale;
        this.likelihood = likelihood;
        this.joinedDay = joinedDay;
        this.interests = profile.interests();
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ActorKind getKind() {
        return kind;
    }

    public boolean isPage() {
        return kind == ActorKind.PAGE;
    }

    public ActorProfile getProfile() {
        return profile;
    }

    public int getRoundActions() {
        return roundActions;
    }

    public double getActivityScale() {
        return activityScale;
    }

    /**
     * Returns the personal action distribution, falling back to the given global one.
     *
     * @param global distribution configured for this actor kind
     * @return the distribution to select from
     */
    public ActionLikelihood likelihoodOr(ActionLikelihood global) {
        return likelihood != null ? likelihood : global;
    }

    public boolean hasPersonalLikelihood() {
        return likelihood != null;
    }

    /**
     * Resource class hint: whether the actor's action set needs language-model inference.
     */
    public boolean requiresInference(ActionLikelihood global) {
        return likelihoodOr(global).requiresInference();
    }

    public int getJoinedDay() {
        return joinedDay;
    }

    public LifecycleState getState() {
        return state;
    }

    public boolean isLive() {
        return state == LifecycleState.ACTIVE;
    }

    void markChurned() {
        this.state = LifecycleState.CHURNED;
    }

    public long getLastActiveSlot() {
        return lastActiveSlot;
    }

    public void recordActivity(long slot) {
        this.lastActiveSlot = slot;
    }

    public int getPendingMentions() {
        return pendingMentions;
    }

    public void setPendingMentions(int pendingMentions) {
        this.pendingMentions = Math.max(0, pendingMentions);
    }

    public int getLastCastDay() {
        return lastCastDay;
    }

    public void recordCast(int day) {
        this.lastCastDay = day;
    }

    public List<String> getInterests() {
        return interests;
    }

    public void setInterests(List<String> interests) {
        this.interests = List.copyOf(interests);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Actor other && other.id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(java.util.Locale.ROOT) + " " + name + " #" + id;
    }
}
