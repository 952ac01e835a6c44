package org.ysim.runtime.actions;

import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.Map;
import java.util.Optional;

/**
 * Re-shares a news article from the actor's feed with a short accompanying text.
 */
public class ShareAction extends GeneratingAction {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Optional<Long> post = pickPost(ctx, true);
        if (post.isEmpty()) {
            return;
        }
        String original = ctx.getContent().getPostText(post.get());
        String text = generate(ctx, PromptBuilder.SHARE, Map.of("post_text", original));
        if (!isPublishable(text)) {
            return;
        }
        ctx.getContent().share(ctx.getActor().getId(), post.get(), text, annotate(ctx, text), ctx.getTime());
    }
}
