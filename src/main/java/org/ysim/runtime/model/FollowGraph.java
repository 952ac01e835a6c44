package org.ysim.runtime.model;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Directed follow edges between actors, indexed in both directions.
 * <p>
 * Edge operations are idempotent and safe to call from concurrent action workers: adding an
 * existing edge or removing a missing one changes nothing. {@link #removeActor(long)} drops every
 * edge in which the actor is follower or followee and is only called at day boundaries.
 */
public class FollowGraph {

    private final Map<Long, Set<Long>> followees = new ConcurrentHashMap<>();
    private final Map<Long, Set<Long>> followers = new ConcurrentHashMap<>();
    private final AtomicLong edgeCount = new AtomicLong();

    /**
     * Adds the edge {@code follower -> followee}.
     *
     * @return {@code true} if the edge was new
     * @throws IllegalArgumentException for a self-edge
     */
    public boolean addEdge(long follower, long followee) {
        if (follower == followee) {
            throw new IllegalArgumentException("Actor " + follower + " cannot follow itself");
        }
        boolean added = followees.computeIfAbsent(follower, k -> ConcurrentHashMap.newKeySet()).add(followee);
        if (added) {
            followers.computeIfAbsent(followee, k -> ConcurrentHashMap.newKeySet()).add(follower);
            edgeCount.incrementAndGet();
        }
        return added;
    }

    /**
     * Removes the edge {@code follower -> followee}.
     *
     * @return {@code true} if the edge existed
     */
    public boolean removeEdge(long follower, long followee) {
        Set<Long> out = followees.get(follower);
        boolean removed = out != null && out.remove(followee);
        if (removed) {
            Set<Long> in = followers.get(followee);
            if (in != null) {
                in.remove(follower);
            }
            edgeCount.decrementAndGet();
        }
        return removed;
    }

    /**
     * Removes all edges incident to an actor.
     *
     * @return number of edges removed
     */
    public int removeActor(long actorId) {
        int removed = 0;
        Set<Long> out = followees.remove(actorId);
        if (out != null) {
            for (long followee : out) {
                Set<Long> in = followers.get(followee);
                if (in != null && in.remove(actorId)) {
                    removed++;
                }
            }
        }
        Set<Long> in = followers.remove(actorId);
        if (in != null) {
            for (long follower : in) {
                Set<Long> o = followees.get(follower);
                if (o != null && o.remove(actorId)) {
                    removed++;
                }
            }
        }
        edgeCount.addAndGet(-removed);
        return removed;
    }

    public boolean contains(long follower, long followee) {
        Set<Long> out = followees.get(follower);
        return out != null && out.contains(followee);
    }

    /**
     * @return ids the actor follows, sorted ascending
     */
    public LongList followeesOf(long actorId) {
        return sorted(followees.get(actorId));
    }

    /**
     * @return ids following the actor, sorted ascending
     */
    public LongList followersOf(long actorId) {
        return sorted(followers.get(actorId));
    }

    public long edgeCount() {
        return edgeCount.get();
    }

    private static LongList sorted(Set<Long> ids) {
        LongArrayList list = new LongArrayList();
        if (ids != null) {
            for (long id : ids) {
                list.add(id);
            }
            list.sort(null);
        }
        return list;
    }
}
