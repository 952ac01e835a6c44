package org.ysim.runtime.spi;

import org.ysim.runtime.model.Actor;

import java.util.List;
import java.util.Map;

/**
 * Stable entry point to the pluggable content and follow recommenders. Scores and rankings are
 * computed remotely; this interface only transports candidates.
 */
public interface IRecommenderGateway {

    /**
     * @param articlesOnly restrict the feed to news articles
     * @return post ids recommended to the actor, best first
     */
    List<Long> recommendPosts(Actor actor, boolean articlesOnly) throws GatewayException;

    /**
     * @return post ids matching the actor's interests, best first
     */
    List<Long> searchPosts(Actor actor) throws GatewayException;

    /**
     * @return ids of unanswered posts that mention the actor
     */
    List<Long> mentions(Actor actor) throws GatewayException;

    /**
     * @return candidate followee ids mapped to non-negative recommender scores, best first
     */
    Map<Long, Double> followCandidates(Actor actor) throws GatewayException;
}
