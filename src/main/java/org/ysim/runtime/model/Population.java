package org.ysim.runtime.model;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * The set of live actors, keyed and iterated by id.
 * <p>
 * Ids are unique and never reused: a churned actor's id is retired and {@link #nextActorId()}
 * only moves forward. Mutation ({@link #add}, {@link #churn}) happens on the orchestration thread
 * at day boundaries; lookups from worker threads during a slot are safe.
 */
public class Population {

    private final ConcurrentSkipListMap<Long, Actor> live = new ConcurrentSkipListMap<>();
    private final LongSet retired = new LongOpenHashSet();
    private long nextId;

    /**
     * Adds an actor to the live population.
     *
     * @param actor a new actor in state {@link LifecycleState#ACTIVE}
     * @throws IllegalArgumentException if the id is live, retired, or the actor is churned
     */
    public synchronized void add(Actor actor) {
        if (!actor.isLive()) {
            throw new IllegalArgumentException("Cannot add churned actor " + actor);
        }
        if (live.containsKey(actor.getId()) || retired.contains(actor.getId())) {
            throw new IllegalArgumentException("Actor id " + actor.getId() + " is already in use");
        }
        live.put(actor.getId(), actor);
        nextId = Math.max(nextId, actor.getId() + 1);
    }

    /**
     * Returns a fresh id for a recruited actor. Ids are monotonic and skip every id ever handed out.
     */
    public synchronized long nextActorId() {
        return nextId++;
    }

    /**
     * Removes an actor from the live set and retires its id.
     *
     * @param actorId id of the actor to churn
     * @return the churned actor, or empty if no live actor has this id
     */
    public synchronized Optional<Actor> churn(long actorId) {
        Actor actor = live.remove(actorId);
        if (actor == null) {
            return Optional.empty();
        }
        actor.markChurned();
        retired.add(actorId);
        return Optional.of(actor);
    }

    public Optional<Actor> find(long actorId) {
        return Optional.ofNullable(live.get(actorId));
    }

    public boolean isLive(long actorId) {
        return live.containsKey(actorId);
    }

    public synchronized boolean isRetired(long actorId) {
        return retired.contains(actorId);
    }

    /**
     * Copies the live actors, ordered by id. Taken once per slot before sampling.
     */
    public List<Actor> snapshotLive() {
        return Collections.unmodifiableList(new ArrayList<>(live.values()));
    }

    /**
     * @return live actors of the given kind, ordered by id
     */
    public List<Actor> snapshotLive(ActorKind kind) {
        List<Actor> result = new ArrayList<>();
        for (Actor actor : live.values()) {
            if (actor.getKind() == kind) {
                result.add(actor);
            }
        }
        return result;
    }

    public int liveCount() {
        return live.size();
    }

    public int liveCount(ActorKind kind) {
        int count = 0;
        for (Actor actor : live.values()) {
            if (actor.getKind() == kind) {
                count++;
            }
        }
        return count;
    }

    public synchronized int retiredCount() {
        return retired.size();
    }
}
