package org.ysim.runtime.actions;

import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IActionHandler;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base for heavy actions: target selection, text generation and emotion annotation.
 */
abstract class GeneratingAction implements IActionHandler {

    /** Generated texts shorter than this are discarded instead of published. */
    static final int MIN_TEXT_LENGTH = 3;

    /**
     * Resolves the post the action is aimed at: the intent's target if set, otherwise a uniformly
     * drawn post from the actor's recommended feed.
     *
     * @return the post id, or empty if the feed is empty
     */
    protected Optional<Long> pickPost(ActionContext ctx, boolean articlesOnly) throws GatewayException {
        Long target = ctx.getIntent().targetRef();
        if (target != null) {
            return Optional.of(target);
        }
        List<Long> candidates = ctx.getRecommender().recommendPosts(ctx.getActor(), articlesOnly);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(ctx.getRandom().nextInt(candidates.size())));
    }

    /**
     * Asks the language backend for a text in the actor's persona and cleans the answer.
     */
    protected String generate(ActionContext ctx, String promptKey, Map<String, String> extras)
            throws GatewayException {
        return TextTools.cleanText(ask(ctx, promptKey, extras), ctx.getActor().getName());
    }

    /**
     * Asks the language backend for a raw decision in the actor's persona.
     */
    protected String ask(ActionContext ctx, String promptKey, Map<String, String> extras)
            throws GatewayException {
        PromptBuilder prompts = ctx.getEnvironment().getPrompts();
        return ctx.getLanguage().chat(prompts.persona(ctx.getActor()),
                prompts.render(promptKey, ctx.getActor(), extras));
    }

    /**
     * Extracts the emotions of a generated text when annotation is enabled.
     *
     * @return the emotions, empty when annotation is off
     */
    protected List<String> annotate(ActionContext ctx, String text) throws GatewayException {
        ActionEnvironment env = ctx.getEnvironment();
        if (!env.isAnnotateEmotions()) {
            return List.of();
        }
        String answer = ask(ctx, PromptBuilder.ANNOTATOR,
                Map.of("text", text, "emotions", String.join(", ", env.getEmotions())));
        return TextTools.emotions(answer, env.getEmotions());
    }

    /**
     * Reconsiders the follow relation to the author of a post the actor just engaged with.
     * <p>
     * Runs with the environment's secondary follow probability. The model is only asked when the
     * answer could change something: the author is another live actor and the actor does not
     * already follow it ({@code follow}) or does follow it ({@code !follow}). A YES updates the
     * service and the graph.
     *
     * @param follow {@code true} to consider following, {@code false} to consider unfollowing
     * @return {@code true} if the relation changed
     */
    protected boolean evaluateFollow(ActionContext ctx, long postId, String postText, boolean follow)
            throws GatewayException {
        double probability = ctx.getEnvironment().getSecondaryFollowProbability();
        if (probability <= 0.0 || ctx.getRandom().nextDouble() >= probability) {
            return false;
        }
        long actorId = ctx.getActor().getId();
        long author = ctx.getContent().authorOf(postId);
        FollowGraph graph = ctx.getEnvironment().getGraph();
        if (author == actorId || graph.contains(actorId, author) == follow
                || !ctx.getEnvironment().getPopulation().isLive(author)) {
            return false;
        }
        String answer = ask(ctx, PromptBuilder.FOLLOW,
                Map.of("post_text", postText, "action", follow ? "follow" : "unfollow"));
        if (!TextTools.containsWord(answer, "YES")) {
            return false;
        }
        if (follow) {
            ctx.getContent().follow(actorId, author, ctx.getTime());
            graph.addEdge(actorId, author);
        } else {
            ctx.getContent().unfollow(actorId, author, ctx.getTime());
            graph.removeEdge(actorId, author);
        }
        return true;
    }

    protected static boolean isPublishable(String text) {
        return text.length() >= MIN_TEXT_LENGTH;
    }
}
