package org.ysim.runtime;

import org.ysim.runtime.model.ActionIntent;
import org.ysim.runtime.model.ActionKind;
import org.ysim.runtime.model.ActionLikelihood;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the action an active actor attempts in a slot.
 * <p>
 * The actor's distribution (personal, or the one configured for its kind) is restricted to the
 * kinds that are eligible right now and re-normalized together with the {@code none} weight.
 * A kind is eligible when it is allowed for the actor kind, and additionally:
 * <ul>
 *   <li>{@code CAST} only if the actor has not cast today</li>
 *   <li>{@code REPLY} only if the actor has pending mentions</li>
 * </ul>
 * Nothing eligible, or drawing {@code none}, yields no intent. Draws come from a provider derived
 * for the actor and slot.
 */
public class ActionSelector {

    private final ActionLikelihood userActions;
    private final ActionLikelihood pageActions;
    private final IRandomProvider random;

    public ActionSelector(ActionLikelihood userActions, ActionLikelihood pageActions, IRandomProvider random) {
        this.userActions = userActions;
        this.pageActions = pageActions;
        this.random = random;
    }

    /**
     * Selects one intent per sampled actor, skipping actors that elect not to act.
     *
     * @param sample the actors of the slot
     * @return the intents, users first, each group in id order
     */
    public List<ActionIntent> selectAll(ActivitySampler.SlotSample sample) {
        List<ActionIntent> intents = new ArrayList<>(sample.size());
        for (Actor actor : sample.activeUsers()) {
            select(sample.time(), actor).ifPresent(intents::add);
        }
        for (Actor page : sample.publishingPages()) {
            select(sample.time(), page).ifPresent(intents::add);
        }
        return intents;
    }

    /**
     * @return the chosen intent, or empty for a no-op
     */
    public Optional<ActionIntent> select(SlotTime time, Actor actor) {
        ActionLikelihood likelihood = actor.likelihoodOr(actor.isPage() ? pageActions : userActions);
        Map<ActionKind, Double> eligible = new EnumMap<>(ActionKind.class);
        double total = 0.0;
        for (Map.Entry<ActionKind, Double> entry : likelihood.weights().entrySet()) {
            if (isEligible(entry.getKey(), actor, time)) {
                eligible.put(entry.getKey(), entry.getValue());
                total += entry.getValue();
            }
        }
        if (total <= 0.0) {
            return Optional.empty();
        }
        IRandomProvider rng = random.deriveFor("selection", time.slot()).deriveFor("actor", actor.getId());
        double draw = rng.nextDouble() * (total + likelihood.noneWeight());
        double cumulative = 0.0;
        ActionKind last = null;
        for (Map.Entry<ActionKind, Double> entry : eligible.entrySet()) {
            cumulative += entry.getValue();
            last = entry.getKey();
            if (draw < cumulative) {
                return Optional.of(ActionIntent.of(actor.getId(), time.slot(), last));
            }
        }
        // Rounding can leave the draw just above the last bound when none is not configured.
        if (likelihood.noneWeight() == 0.0) {
            return Optional.of(ActionIntent.of(actor.getId(), time.slot(), last));
        }
        return Optional.empty();
    }

    /**
     * Contextual eligibility of an action for an actor in a slot.
     */
    public static boolean isEligible(ActionKind kind, Actor actor, SlotTime time) {
        if (!kind.isAllowedFor(actor.getKind())) {
            return false;
        }
        return switch (kind) {
            case CAST -> actor.getLastCastDay() != time.day();
            case REPLY -> actor.getPendingMentions() > 0;
            default -> true;
        };
    }
}
