package org.ysim.runtime.actions;

import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.spi.IContentService;
import org.ysim.runtime.spi.ILanguageBackend;
import org.ysim.runtime.spi.IRecommenderGateway;

import java.util.List;
import java.util.Objects;

/**
 * Collaborators and behaviour switches shared by every action execution of a run.
 * Immutable; one instance is created per simulation.
 */
public final class ActionEnvironment {

    private final IContentService content;
    private final IRecommenderGateway recommender;
    private final ILanguageBackend language;
    private final FollowGraph graph;
    private final Population population;
    private final PromptBuilder prompts;
    private final boolean annotateEmotions;
    private final List<String> emotions;
    private final int maxThreadLength;
    private final int attentionWindow;
    private final double secondaryFollowProbability;

    private ActionEnvironment(Builder builder) {
        this.content = Objects.requireNonNull(builder.content, "content");
        this.recommender = Objects.requireNonNull(builder.recommender, "recommender");
        this.language = Objects.requireNonNull(builder.language, "language");
        this.graph = Objects.requireNonNull(builder.graph, "graph");
        this.population = Objects.requireNonNull(builder.population, "population");
        this.prompts = Objects.requireNonNull(builder.prompts, "prompts");
        this.annotateEmotions = builder.annotateEmotions;
        this.emotions = List.copyOf(builder.emotions);
        this.maxThreadLength = builder.maxThreadLength;
        this.attentionWindow = builder.attentionWindow;
        this.secondaryFollowProbability = builder.secondaryFollowProbability;
    }

    public static Builder builder() {
        return new Builder();
    }

    public IContentService getContent() {
        return content;
    }

    public IRecommenderGateway getRecommender() {
        return recommender;
    }

    public ILanguageBackend getLanguage() {
        return language;
    }

    public FollowGraph getGraph() {
        return graph;
    }

    public Population getPopulation() {
        return population;
    }

    public PromptBuilder getPrompts() {
        return prompts;
    }

    /**
     * @return whether generated content gets an extra language-model call extracting its emotions
     */
    public boolean isAnnotateEmotions() {
        return annotateEmotions;
    }

    /**
     * @return the emotion vocabulary annotation is restricted to
     */
    public List<String> getEmotions() {
        return emotions;
    }

    public int getMaxThreadLength() {
        return maxThreadLength;
    }

    public int getAttentionWindow() {
        return attentionWindow;
    }

    /**
     * @return chance of reconsidering the follow relation to a post's author after commenting on
     *         or reacting to the post
     */
    public double getSecondaryFollowProbability() {
        return secondaryFollowProbability;
    }

    public static final class Builder {
        private IContentService content;
        private IRecommenderGateway recommender;
        private ILanguageBackend language;
        private FollowGraph graph;
        private Population population;
        private PromptBuilder prompts = PromptBuilder.defaults();
        private boolean annotateEmotions;
        private List<String> emotions = List.of();
        private int maxThreadLength = 5;
        private int attentionWindow = 336;
        private double secondaryFollowProbability;

        private Builder() {
        }

        public Builder content(IContentService content) {
            this.content = content;
            return this;
        }

        public Builder recommender(IRecommenderGateway recommender) {
            this.recommender = recommender;
            return this;
        }

        public Builder language(ILanguageBackend language) {
            this.language = language;
            return this;
        }

        public Builder graph(FollowGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder population(Population population) {
            this.population = population;
            return this;
        }

        public Builder prompts(PromptBuilder prompts) {
            this.prompts = prompts;
            return this;
        }

        public Builder annotateEmotions(boolean annotateEmotions, List<String> emotions) {
            this.annotateEmotions = annotateEmotions;
            this.emotions = emotions;
            return this;
        }

        public Builder maxThreadLength(int maxThreadLength) {
            this.maxThreadLength = maxThreadLength;
            return this;
        }

        public Builder attentionWindow(int attentionWindow) {
            this.attentionWindow = attentionWindow;
            return this;
        }

        public Builder secondaryFollowProbability(double secondaryFollowProbability) {
            this.secondaryFollowProbability = secondaryFollowProbability;
            return this;
        }

        public ActionEnvironment build() {
            return new ActionEnvironment(this);
        }
    }
}
