package org.ysim.runtime.actions;

import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.List;

/**
 * Searches posts matching the actor's interests.
 */
public class SearchAction extends BrowseAction {

    @Override
    protected List<Long> fetch(ActionContext ctx) throws GatewayException {
        return ctx.getRecommender().searchPosts(ctx.getActor());
    }
}
