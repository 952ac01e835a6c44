package org.ysim.runtime;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.HourlyActivityTable;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides which live actors are active in a slot.
 * <p>
 * Every user is drawn independently with probability {@code fraction(hour) * activityScale},
 * clamped to [0, 1]. Pages are drawn against the page table when one is configured and publish in
 * every slot otherwise. Draws come from a provider derived for the slot and are taken in actor-id
 * order, so the sample depends only on the seed, the slot and the snapshot.
 * <p>
 * When an actor has a {@code roundActions} budget the sampler leaves it out once it has acted that
 * many times in the day. Actions are reported through {@link #recordAction(long)} after selection,
 * so a slot where the actor was sampled but chose nothing costs no budget. This counter is the
 * only state kept across slots; it is cleared when the day changes. Not thread-safe: used by the
 * orchestration thread only.
 */
public class ActivitySampler {

    private static final Logger LOG = LoggerFactory.getLogger(ActivitySampler.class);

    /**
     * Actors sampled for one slot.
     *
     * @param time            the slot
     * @param activeUsers     users active in this slot, ordered by id
     * @param publishingPages pages eligible to publish in this slot, ordered by id
     */
    public record SlotSample(SlotTime time, List<Actor> activeUsers, List<Actor> publishingPages) {

        public int size() {
            return activeUsers.size() + publishingPages.size();
        }
    }

    private final HourlyActivityTable userTable;
    private final HourlyActivityTable pageTable;
    private final IRandomProvider random;
    private final Long2IntOpenHashMap actionsToday = new Long2IntOpenHashMap();
    private int counterDay = -1;

    /**
     * @param userTable activity fractions of users
     * @param pageTable publishing fractions of pages, or {@code null} to let pages publish every slot
     * @param random    run-level random provider, only ever derived from
     */
    public ActivitySampler(HourlyActivityTable userTable, HourlyActivityTable pageTable, IRandomProvider random) {
        this.userTable = userTable;
        this.pageTable = pageTable;
        this.random = random;
        warnMissing("user", userTable);
        if (pageTable != null) {
            warnMissing("page", pageTable);
        }
    }

    private static void warnMissing(String what, HourlyActivityTable table) {
        List<Integer> missing = table.missingHours();
        if (!missing.isEmpty()) {
            LOG.warn("The {} activity table has no entry for hours {}: nobody will be active then",
                    what, missing);
        }
    }

    /**
     * Samples the active actors of a slot.
     *
     * @param time the slot
     * @param live snapshot of the live population, ordered by id
     * @return the sample; never larger than {@code live}
     */
    public SlotSample sample(SlotTime time, List<Actor> live) {
        if (time.day() != counterDay) {
            actionsToday.clear();
            counterDay = time.day();
        }
        IRandomProvider rng = random.deriveFor("activity", time.slot());
        List<Actor> users = new ArrayList<>();
        List<Actor> pages = new ArrayList<>();
        for (Actor actor : live) {
            boolean active;
            if (actor.isPage()) {
                active = pageTable == null || draw(rng, pageTable.fraction(time.hour()), 1.0);
            } else {
                active = draw(rng, userTable.fraction(time.hour()), actor.getActivityScale());
            }
            if (!active || exhausted(actor)) {
                continue;
            }
            (actor.isPage() ? pages : users).add(actor);
        }
        return new SlotSample(time, Collections.unmodifiableList(users), Collections.unmodifiableList(pages));
    }

    /**
     * One Bernoulli trial. Certain outcomes consume no random value.
     */
    private static boolean draw(IRandomProvider rng, double fraction, double scale) {
        double p = Math.min(1.0, Math.max(0.0, fraction * scale));
        if (p >= 1.0) {
            return true;
        }
        if (p <= 0.0) {
            return false;
        }
        return rng.nextDouble() < p;
    }

    private boolean exhausted(Actor actor) {
        int budget = actor.getRoundActions();
        return budget > 0 && actionsToday.get(actor.getId()) >= budget;
    }

    /**
     * Counts one action of an actor against today's budget. Called once per selected intent of the
     * slot last passed to {@link #sample}.
     */
    public void recordAction(long actorId) {
        actionsToday.addTo(actorId, 1);
    }

    /**
     * @return actions already counted for an actor today
     */
    public int actionsToday(long actorId) {
        return actionsToday.get(actorId);
    }
}
