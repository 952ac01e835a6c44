package org.ysim.runtime.actions;

import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.Map;

/**
 * Writes and publishes an original post about the actor's interests.
 */
public class PostAction extends GeneratingAction {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        String text = generate(ctx, PromptBuilder.POST, Map.of());
        if (!isPublishable(text)) {
            return;
        }
        ctx.getContent().publishPost(ctx.getActor().getId(), text, TextTools.hashtags(text),
                TextTools.mentions(text), annotate(ctx, text), ctx.getTime());
    }
}
