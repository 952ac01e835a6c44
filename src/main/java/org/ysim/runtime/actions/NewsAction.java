package org.ysim.runtime.actions;

import org.ysim.runtime.model.Actor;
import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.List;
import java.util.Map;

/**
 * A page publishes a news article on its topic.
 */
public class NewsAction extends GeneratingAction {

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Actor page = ctx.getActor();
        List<String> topics = page.getInterests();
        String topic = topics.isEmpty() ? "current events" : topics.get(ctx.getRandom().nextInt(topics.size()));
        String text = generate(ctx, PromptBuilder.NEWS, Map.of("topic", topic, "page", page.getName()));
        if (!isPublishable(text)) {
            return;
        }
        String link = page.getProfile().feedUrl() != null ? page.getProfile().feedUrl() : "";
        ctx.getContent().publishArticle(page.getId(), headline(text), text, link,
                annotate(ctx, text), ctx.getTime());
    }

    /**
     * Uses the first sentence as the article title.
     */
    static String headline(String text) {
        int end = text.indexOf('.');
        String title = end > 0 ? text.substring(0, end) : text;
        return title.length() > 120 ? title.substring(0, 120) : title;
    }
}
