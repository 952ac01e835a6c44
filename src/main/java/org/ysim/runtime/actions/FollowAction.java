package org.ysim.runtime.actions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IActionHandler;
import org.ysim.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Follows one actor suggested by the follow recommender.
 * <p>
 * The target is drawn with probability proportional to its recommender score, among live actors
 * other than the follower that it does not follow yet. An intent carrying a target follows that
 * actor directly. Following is idempotent on both the graph and the service.
 */
public class FollowAction implements IActionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(FollowAction.class);

    @Override
    public void execute(ActionContext ctx) throws GatewayException {
        Actor actor = ctx.getActor();
        Population population = ctx.getEnvironment().getPopulation();
        FollowGraph graph = ctx.getEnvironment().getGraph();

        OptionalLong target;
        Long explicit = ctx.getIntent().targetRef();
        if (explicit != null) {
            target = explicit != actor.getId() && population.isLive(explicit)
                    ? OptionalLong.of(explicit) : OptionalLong.empty();
        } else {
            Map<Long, Double> candidates = ctx.getRecommender().followCandidates(actor);
            target = choose(candidates, actor.getId(), population, graph, ctx.getRandom());
        }
        if (target.isEmpty()) {
            LOG.debug("{} found no one to follow at {}", actor, ctx.getTime());
            return;
        }
        ctx.getContent().follow(actor.getId(), target.getAsLong(), ctx.getTime());
        graph.addEdge(actor.getId(), target.getAsLong());
    }

    /**
     * Draws one valid candidate with probability proportional to its score. When every valid
     * candidate scores zero the draw is uniform.
     *
     * @return the chosen actor id, or empty if no candidate is valid
     */
    static OptionalLong choose(Map<Long, Double> candidates, long follower, Population population,
                               FollowGraph graph, IRandomProvider random) {
        List<Long> ids = new ArrayList<>();
        List<Double> scores = new ArrayList<>();
        double total = 0.0;
        for (Map.Entry<Long, Double> entry : candidates.entrySet()) {
            long id = entry.getKey();
            if (id == follower || !population.isLive(id) || graph.contains(follower, id)) {
                continue;
            }
            double score = entry.getValue() == null || entry.getValue() < 0.0 ? 0.0 : entry.getValue();
            ids.add(id);
            scores.add(score);
            total += score;
        }
        if (ids.isEmpty()) {
            return OptionalLong.empty();
        }
        if (total <= 0.0) {
            return OptionalLong.of(ids.get(random.nextInt(ids.size())));
        }
        double draw = random.nextDouble() * total;
        double cumulative = 0.0;
        for (int i = 0; i < ids.size(); i++) {
            cumulative += scores.get(i);
            if (draw < cumulative) {
                return OptionalLong.of(ids.get(i));
            }
        }
        return OptionalLong.of(ids.get(ids.size() - 1));
    }
}
