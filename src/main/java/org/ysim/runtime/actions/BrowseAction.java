package org.ysim.runtime.actions;

import org.ysim.runtime.model.Actor;
import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IActionHandler;

import java.util.List;

/**
 * Base for light browsing actions: fetch posts, fold their topics into the actor's interests and
 * refresh the count of unanswered mentions.
 * <p>
 * Browsing repeats cleanly, which is why these actions are retried after transient failures.
 */
abstract class BrowseAction implements IActionHandler {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Actor actor = ctx.getActor();
        List<Long> posts = fetch(ctx);
        if (!posts.isEmpty()) {
            List<String> interests = ctx.getContent().updateInterests(actor.getId(), posts,
                    ctx.getEnvironment().getAttentionWindow(), ctx.getTime());
            actor.setInterests(interests);
        }
        actor.setPendingMentions(ctx.getRecommender().mentions(actor).size());
    }

    protected abstract List<Long> fetch(ActionContext ctx) throws GatewayException;
}
