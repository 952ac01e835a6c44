package org.ysim.runtime.actions;

import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a conversation from the actor's feed and adds a comment to it. Afterwards the actor may
 * follow the post's author or, if it does not, unfollow it.
 */
public class CommentAction extends GeneratingAction {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Optional<Long> post = pickPost(ctx, false);
        if (post.isPresent()) {
            commentOn(ctx, post.get());
        }
    }

    /**
     * Generates and publishes a comment below the given post.
     *
     * @return {@code true} if a comment was published
     */
    protected boolean commentOn(ActionContext ctx, long postId) throws GatewayException {
        List<String> thread = ctx.getContent().getThread(postId, ctx.getEnvironment().getMaxThreadLength());
        String text = generate(ctx, PromptBuilder.COMMENT, Map.of("thread", String.join("\n", thread)));
        if (!isPublishable(text)) {
            return false;
        }
        ctx.getContent().comment(ctx.getActor().getId(), postId, text, TextTools.hashtags(text),
                TextTools.mentions(text), annotate(ctx, text), ctx.getTime());
        String postText = thread.isEmpty() ? "" : thread.get(thread.size() - 1);
        if (!evaluateFollow(ctx, postId, postText, true)) {
            evaluateFollow(ctx, postId, postText, false);
        }
        return true;
    }
}
