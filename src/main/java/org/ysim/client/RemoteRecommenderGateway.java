package org.ysim.client;

import org.ysim.runtime.config.SimulationSettings.RecommenderSettings;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IRecommenderGateway;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link IRecommenderGateway} that asks the content service to run the configured strategies.
 * <p>
 * Strategies are fixed per run; the gateway is stateless apart from them and safe for concurrent use.
 */
public final class RemoteRecommenderGateway implements IRecommenderGateway {

    private final HttpJsonClient http;
    private final ContentStrategy contentStrategy;
    private final FollowStrategy followStrategy;
    private final int postLimit;
    private final int followLimit;
    private final double leaningBias;
    private final int visibilitySlots;

    public RemoteRecommenderGateway(HttpJsonClient http, ContentStrategy contentStrategy,
                                    FollowStrategy followStrategy, int postLimit, int followLimit,
                                    double leaningBias, int visibilitySlots) {
        this.http = Objects.requireNonNull(http, "http");
        this.contentStrategy = Objects.requireNonNull(contentStrategy, "contentStrategy");
        this.followStrategy = Objects.requireNonNull(followStrategy, "followStrategy");
        this.postLimit = postLimit;
        this.followLimit = followLimit;
        this.leaningBias = leaningBias;
        this.visibilitySlots = visibilitySlots;
    }

    /**
     * Builds a gateway from settings, resolving the strategy names.
     *
     * @throws org.ysim.runtime.config.ConfigurationException if a strategy name is unknown
     */
    public static RemoteRecommenderGateway fromSettings(HttpJsonClient http, RecommenderSettings settings) {
        return new RemoteRecommenderGateway(http,
                ContentStrategy.fromName(settings.contentStrategy()),
                FollowStrategy.fromName(settings.followStrategy()),
                settings.postLimit(),
                settings.followLimit(),
                settings.leaningBias(),
                settings.visibilitySlots());
    }

    public ContentStrategy getContentStrategy() {
        return contentStrategy;
    }

    public FollowStrategy getFollowStrategy() {
        return followStrategy;
    }

    @Override
    public List<Long> recommendPosts(Actor actor, boolean articlesOnly) throws GatewayException {
        Map<String, Object> body = contentRequest(actor);
        if (articlesOnly) {
            body.put("articles", true);
        }
        return JsonReplies.ids("/read", http.post("/read", body));
    }

    @Override
    public List<Long> searchPosts(Actor actor) throws GatewayException {
        return JsonReplies.ids("/search", http.post("/search", contentRequest(actor)));
    }

    @Override
    public List<Long> mentions(Actor actor) throws GatewayException {
        return JsonReplies.ids("/read_mentions", http.post("/read_mentions", contentRequest(actor)));
    }

    @Override
    public Map<Long, Double> followCandidates(Actor actor) throws GatewayException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", followStrategy.getMode());
        body.put("n_neighbors", followLimit);
        body.put("leaning_biased", leaningBias);
        body.put("user_id", actor.getId());
        return JsonReplies.scores("/follow_suggestions", http.post("/follow_suggestions", body));
    }

    private Map<String, Object> contentRequest(Actor actor) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("limit", postLimit);
        body.put("mode", contentStrategy.getMode());
        body.put("visibility_rounds", visibilitySlots);
        body.put("uid", actor.getId());
        return body;
    }
}
