package org.ysim.runtime.actions;

import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;

import java.util.List;

/**
 * Reads the actor's recommended feed.
 */
public class ReadAction extends BrowseAction {

    @Override
    protected List<Long> fetch(ActionContext ctx) throws GatewayException {
        return ctx.getRecommender().recommendPosts(ctx.getActor(), false);
    }
}
