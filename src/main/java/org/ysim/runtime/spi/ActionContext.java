package org.ysim.runtime.spi;

import org.ysim.runtime.actions.ActionEnvironment;
import org.ysim.runtime.model.ActionIntent;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.SlotTime;

/**
 * Everything an {@link IActionHandler} may use while executing one intent.
 * <p>
 * The random provider is derived for this actor and slot, so a handler draws the same values
 * whichever worker thread runs it and whichever pool mode is configured.
 * </p>
 */
public final class ActionContext {

    private final SlotTime time;
    private final Actor actor;
    private final ActionIntent intent;
    private final IRandomProvider random;
    private final ActionEnvironment environment;

    public ActionContext(SlotTime time, Actor actor, ActionIntent intent, IRandomProvider random,
                         ActionEnvironment environment) {
        if (intent.actorId() != actor.getId()) {
            throw new IllegalArgumentException("Intent for actor " + intent.actorId()
                    + " does not belong to " + actor);
        }
        this.time = time;
        this.actor = actor;
        this.intent = intent;
        this.random = random;
        this.environment = environment;
    }

    public SlotTime getTime() {
        return time;
    }

    public Actor getActor() {
        return actor;
    }

    public ActionIntent getIntent() {
        return intent;
    }

    public IRandomProvider getRandom() {
        return random;
    }

    public ActionEnvironment getEnvironment() {
        return environment;
    }

    public IContentService getContent() {
        return environment.getContent();
    }

    public IRecommenderGateway getRecommender() {
        return environment.getRecommender();
    }

    public ILanguageBackend getLanguage() {
        return environment.getLanguage();
    }
}
