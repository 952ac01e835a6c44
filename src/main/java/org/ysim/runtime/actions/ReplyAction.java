package org.ysim.runtime.actions;

import org.ysim.runtime.model.Actor;
import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.List;

/**
 * Answers the oldest post that mentions the actor.
 */
public class ReplyAction extends CommentAction {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Actor actor = ctx.getActor();
        List<Long> mentions = ctx.getRecommender().mentions(actor);
        if (mentions.isEmpty()) {
            actor.setPendingMentions(0);
            return;
        }
        commentOn(ctx, mentions.get(0));
        actor.setPendingMentions(mentions.size() - 1);
    }
}
