package org.ysim.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BinaryOperator;

import org.ysim.runtime.actions.ActionEnvironment;
import org.ysim.runtime.config.SimulationSettings;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorKind;
import org.ysim.runtime.model.ActorProfile;
import org.ysim.runtime.model.FollowGraph;
import org.ysim.runtime.model.Population;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IActorFactory;
import org.ysim.runtime.spi.IContentService;
import org.ysim.runtime.spi.ILanguageBackend;
import org.ysim.runtime.spi.IRandomProvider;
import org.ysim.runtime.spi.IRecommenderGateway;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Test utilities: a self-contained configuration and in-memory stand-ins for every external system.
 * <p>
 * The base configuration is inline so tests do not depend on {@code config/ysim.conf}; only
 * {@code reference.conf} supplies the remaining defaults.
 */
public final class SimulationFixtures {

    /** Every hour fully active, users only read. */
    private static final String BASE_CONFIG = """
            simulation {
              days = 1
              slots-per-day = 4
              starting-agents = 5
              seed = 7
              hourly-activity { 0: 1.0, 1: 1.0, 2: 1.0, 3: 1.0 }
              actions-likelihood { read = 1.0 }
            }
            agents.round-actions { min = 0, max = 0 }
            population.follow.probability = 0.0
            dispatch {
              mode = sequential
              action-timeout = 5s
            }
            """;

    private SimulationFixtures() {
    }

    /**
     * @param overrides HOCON applied over the base test configuration
     */
    public static Config config(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseString(BASE_CONFIG))
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    public static SimulationSettings settings(String overrides) {
        return SimulationSettings.from(config(overrides));
    }

    public static ActorProfile profile(List<String> interests) {
        return new ActorProfile("agent@ysim.invalid", 30, "female", "Italian", "English", "Democrat",
                "master", "no", "open to experience", "conscientious", "extravert", "agreeable",
                "emotionally stable", interests, null);
    }

    public static Actor user(long id) {
        return new Actor(id, "user" + id, ActorKind.USER, profile(List.of("politics", "sports")), 0, 1.0, null, 0);
    }

    public static Actor user(long id, int roundActions, double activityScale) {
        return new Actor(id, "user" + id, ActorKind.USER, profile(List.of("politics")), roundActions,
                activityScale, null, 0);
    }

    public static Actor page(long id) {
        ActorProfile profile = new ActorProfile("page" + id + "@ysim.invalid", 0, null, null, "English",
                "Democrat", null, "no", null, null, null, null, null, List.of("politics"),
                "https://news.example.org/feed" + id);
        return new Actor(id, "page" + id, ActorKind.PAGE, profile, 0, 1.0, null, 0);
    }

    /**
     * Environment wired to in-memory collaborators and an agreeable language backend.
     */
    public static ActionEnvironment environment(InMemoryContentService content, Population population,
                                                FollowGraph graph) {
        return ActionEnvironment.builder()
                .content(content)
                .recommender(new InMemoryRecommender(content))
                .language(ScriptedLanguageBackend.agreeable())
                .population(population)
                .graph(graph)
                .build();
    }

    /**
     * Creates plain users and pages without drawing anything.
     */
    public static final class SimpleActorFactory implements IActorFactory {

        @Override
        public Actor createUser(long id, int joinedDay, IRandomProvider random) {
            return new Actor(id, "user" + id, ActorKind.USER, profile(List.of("politics")), 0, 1.0, null, joinedDay);
        }

        @Override
        public Actor createPage(long id, int index, IRandomProvider random) {
            return page(id);
        }
    }

    /**
     * Thread-safe content service keeping posts, follows and churns in memory.
     */
    public static final class InMemoryContentService implements IContentService {

        /** One stored post or comment. */
        public record StoredPost(long id, long author, String text, Long parent) {
        }

        private final AtomicLong nextPostId = new AtomicLong(1);
        private final Map<Long, StoredPost> posts = new ConcurrentHashMap<>();
        private final Set<Long> registered = ConcurrentHashMap.newKeySet();
        private final Set<Long> churned = ConcurrentHashMap.newKeySet();
        private final Set<Long> failingChurn = ConcurrentHashMap.newKeySet();
        private final Set<String> follows = ConcurrentHashMap.newKeySet();
        private final List<String> reactions = new CopyOnWriteArrayList<>();
        private final List<String> votes = new CopyOnWriteArrayList<>();
        private final List<SlotTime> clock = new CopyOnWriteArrayList<>();
        private volatile boolean failRegistration;

        public void failChurnFor(long actorId) {
            failingChurn.add(actorId);
        }

        public void failRegistration(boolean fail) {
            this.failRegistration = fail;
        }

        public long seedPost(long author, String text) {
            long id = nextPostId.getAndIncrement();
            posts.put(id, new StoredPost(id, author, text, null));
            return id;
        }

        @Override
        public void register(Actor actor, int joinedDay) throws GatewayException {
            if (failRegistration) {
                throw GatewayException.transientFailure("registration unavailable", null);
            }
            registered.add(actor.getId());
        }

        @Override
        public void reset() {
            posts.clear();
            registered.clear();
            follows.clear();
        }

        @Override
        public void updateTime(SlotTime time) {
            clock.add(time);
        }

        @Override
        public long publishPost(long actorId, String text, List<String> hashtags, List<String> mentions,
                                List<String> emotions, SlotTime time) {
            return seedPost(actorId, text);
        }

        @Override
        public long publishArticle(long pageId, String title, String summary, String link, List<String> emotions,
                                   SlotTime time) {
            return seedPost(pageId, title + ": " + summary);
        }

        @Override
        public long comment(long actorId, long postId, String text, List<String> hashtags, List<String> mentions,
                            List<String> emotions, SlotTime time) {
            long id = nextPostId.getAndIncrement();
            posts.put(id, new StoredPost(id, actorId, text, postId));
            return id;
        }

        @Override
        public long share(long actorId, long postId, String text, List<String> emotions, SlotTime time) {
            long id = nextPostId.getAndIncrement();
            posts.put(id, new StoredPost(id, actorId, text, postId));
            return id;
        }

        @Override
        public void react(long actorId, long postId, String reaction, SlotTime time) {
            reactions.add(actorId + ":" + postId + ":" + reaction);
        }

        @Override
        public void castVote(long actorId, long postId, String preference, SlotTime time) {
            votes.add(actorId + ":" + postId + ":" + preference);
        }

        @Override
        public void follow(long followerId, long followeeId, SlotTime time) {
            follows.add(followerId + "->" + followeeId);
        }

        @Override
        public void unfollow(long followerId, long followeeId, SlotTime time) {
            follows.remove(followerId + "->" + followeeId);
        }

        @Override
        public String getPostText(long postId) throws GatewayException {
            return post(postId).text();
        }

        @Override
        public List<String> getThread(long postId, int maxLength) throws GatewayException {
            List<String> thread = new ArrayList<>();
            StoredPost current = post(postId);
            while (current != null) {
                thread.add(0, current.text());
                current = current.parent() == null ? null : posts.get(current.parent());
            }
            return thread.size() <= maxLength ? thread : thread.subList(thread.size() - maxLength, thread.size());
        }

        @Override
        public long authorOf(long postId) throws GatewayException {
            return post(postId).author();
        }

        @Override
        public List<String> updateInterests(long actorId, List<Long> postIds, int attentionWindow, SlotTime time) {
            return List.of("politics");
        }

        @Override
        public void churn(long actorId, SlotTime time) throws GatewayException {
            if (failingChurn.contains(actorId)) {
                throw new GatewayException("churn rejected for " + actorId);
            }
            churned.add(actorId);
        }

        private StoredPost post(long postId) throws GatewayException {
            StoredPost post = posts.get(postId);
            if (post == null) {
                throw new GatewayException("No post " + postId);
            }
            return post;
        }

        public List<StoredPost> getPosts() {
            List<StoredPost> all = new ArrayList<>(posts.values());
            all.sort((a, b) -> Long.compare(a.id(), b.id()));
            return all;
        }

        public Set<Long> getRegistered() {
            return Collections.unmodifiableSet(registered);
        }

        public Set<Long> getChurned() {
            return Collections.unmodifiableSet(churned);
        }

        public Set<String> getFollows() {
            return Collections.unmodifiableSet(follows);
        }

        public List<String> getReactions() {
            return Collections.unmodifiableList(reactions);
        }

        public List<String> getVotes() {
            return Collections.unmodifiableList(votes);
        }

        public List<SlotTime> getClockUpdates() {
            return Collections.unmodifiableList(clock);
        }
    }

    /**
     * Recommends every stored post, newest first, and every registered actor as follow candidate.
     */
    public static final class InMemoryRecommender implements IRecommenderGateway {

        private final InMemoryContentService content;

        public InMemoryRecommender(InMemoryContentService content) {
            this.content = content;
        }

        @Override
        public List<Long> recommendPosts(Actor actor, boolean articlesOnly) {
            List<Long> ids = new ArrayList<>();
            for (InMemoryContentService.StoredPost post : content.getPosts()) {
                ids.add(0, post.id());
            }
            return ids;
        }

        @Override
        public List<Long> searchPosts(Actor actor) {
            return recommendPosts(actor, false);
        }

        @Override
        public List<Long> mentions(Actor actor) {
            return List.of();
        }

        @Override
        public Map<Long, Double> followCandidates(Actor actor) {
            Map<Long, Double> candidates = new LinkedHashMap<>();
            content.getRegistered().stream().sorted().forEach(id -> candidates.put(id, 1.0));
            return candidates;
        }
    }

    /**
     * Answers every prompt through a function of (system prompt, user prompt).
     */
    public static final class ScriptedLanguageBackend implements ILanguageBackend {

        private final BinaryOperator<String> answer;

        public ScriptedLanguageBackend(BinaryOperator<String> answer) {
            this.answer = answer;
        }

        /**
         * Writes a fixed post, likes everything and votes LEFT.
         */
        public static ScriptedLanguageBackend agreeable() {
            return new ScriptedLanguageBackend((system, user) -> {
                if (user.contains("YES or NO")) {
                    return "YES";
                }
                if (user.contains("RIGHT, LEFT or NONE")) {
                    return "LEFT";
                }
                if (user.contains("emotions")) {
                    return "joy, trust";
                }
                return "Interesting day in politics. #news";
            });
        }

        @Override
        public String chat(String systemPrompt, String userPrompt) {
            return answer.apply(systemPrompt, userPrompt);
        }
    }
}
