package org.ysim.runtime.actions;

import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.Map;
import java.util.Optional;

/**
 * Likes or dislikes a post from the feed. A like may lead to following the post's author, a
 * dislike to unfollowing it.
 */
public class ReactAction extends GeneratingAction {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Optional<Long> post = pickPost(ctx, false);
        if (post.isEmpty()) {
            return;
        }
        long postId = post.get();
        String postText = ctx.getContent().getPostText(postId);
        String answer = ask(ctx, PromptBuilder.REACTION, Map.of("post_text", postText));
        long actorId = ctx.getActor().getId();
        if (TextTools.containsWord(answer, "YES")) {
            ctx.getContent().react(actorId, postId, "like", ctx.getTime());
            evaluateFollow(ctx, postId, postText, true);
        } else if (TextTools.containsWord(answer, "NO")) {
            ctx.getContent().react(actorId, postId, "dislike", ctx.getTime());
            evaluateFollow(ctx, postId, postText, false);
        }
    }
}
