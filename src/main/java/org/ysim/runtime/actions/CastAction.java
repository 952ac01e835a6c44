package org.ysim.runtime.actions;

import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.Map;
import java.util.Optional;

/**
 * Expresses a voting preference triggered by a post. At most once per actor and day.
 */
public class CastAction extends GeneratingAction {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Optional<Long> post = pickPost(ctx, false);
        if (post.isEmpty()) {
            return;
        }
        String answer = ask(ctx, PromptBuilder.CAST,
                Map.of("post_text", ctx.getContent().getPostText(post.get())));
        String vote = toVote(answer);
        if (vote == null) {
            return;
        }
        ctx.getContent().castVote(ctx.getActor().getId(), post.get(), vote, ctx.getTime());
        ctx.getActor().recordCast(ctx.getTime().day());
    }

    /**
     * Maps a model answer to the service's vote codes.
     *
     * @return {@code R}, {@code D}, {@code U}, or {@code null} if the answer names no side
     */
    static String toVote(String answer) {
        if (TextTools.containsWord(answer, "RIGHT")) {
            return "R";
        }
        if (TextTools.containsWord(answer, "LEFT")) {
            return "D";
        }
        if (TextTools.containsWord(answer, "NONE")) {
            return "U";
        }
        return null;
    }
}
