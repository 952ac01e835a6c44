package org.ysim.client;

import com.google.gson.JsonElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.ActorProfile;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IContentService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link IContentService} backed by the YServer REST API.
 * <p>
 * Every operation is one JSON POST. Actor ids are sent as the server's {@code user_id}; the
 * absolute slot is sent as the round id {@code tid}.
 */
public final class YServerClient implements IContentService {

    private static final Logger LOG = LoggerFactory.getLogger(YServerClient.class);

    private final HttpJsonClient http;

    public YServerClient(HttpJsonClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public void register(Actor actor, int joinedDay) throws GatewayException {
        ActorProfile profile = actor.getProfile();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", actor.getId());
        body.put("name", actor.getName());
        body.put("email", profile.email());
        body.put("password", actor.getName());
        body.put("leaning", profile.leaning());
        body.put("age", profile.age());
        body.put("user_type", actor.getKind().name().toLowerCase(Locale.ROOT));
        body.put("is_page", actor.isPage() ? 1 : 0);
        body.put("interests", profile.interests());
        body.put("oe", profile.openness());
        body.put("co", profile.conscientiousness());
        body.put("ex", profile.extraversion());
        body.put("ag", profile.agreeableness());
        body.put("ne", profile.neuroticism());
        body.put("language", profile.language());
        body.put("education_level", profile.education());
        body.put("toxicity", profile.toxicity());
        body.put("round_actions", actor.getRoundActions());
        body.put("gender", profile.gender());
        body.put("nationality", profile.nationality());
        body.put("joined_on", joinedDay);
        if (profile.feedUrl() != null) {
            body.put("feed_url", profile.feedUrl());
        }
        http.post("/register", body);
        LOG.debug("Registered {} {} ({})", actor.getKind(), actor.getId(), actor.getName());
    }

    @Override
    public void reset() throws GatewayException {
        http.post("/reset", null);
        LOG.info("Content service at {} reset", http.getBaseUrl());
    }

    @Override
    public void updateTime(SlotTime time) throws GatewayException {
        http.post("/update_time", Map.of("day", time.day(), "round", time.hour()));
    }

    @Override
    public long publishPost(long actorId, String text, List<String> hashtags, List<String> mentions,
                            List<String> emotions, SlotTime time) throws GatewayException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", actorId);
        body.put("tweet", text);
        body.put("emotions", emotions);
        body.put("hashtags", hashtags);
        body.put("mentions", mentions);
        body.put("tid", time.slot());
        return JsonReplies.createdId("/post", http.post("/post", body));
    }

    @Override
    public long publishArticle(long pageId, String title, String summary, String link, List<String> emotions,
                               SlotTime time) throws GatewayException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", pageId);
        body.put("tweet", title + ": " + summary);
        body.put("title", title);
        body.put("summary", summary);
        body.put("link", link);
        body.put("emotions", emotions);
        body.put("hashtags", List.of());
        body.put("mentions", List.of());
        body.put("tid", time.slot());
        return JsonReplies.createdId("/news", http.post("/news", body));
    }

    @Override
    public long comment(long actorId, long postId, String text, List<String> hashtags, List<String> mentions,
                        List<String> emotions, SlotTime time) throws GatewayException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", actorId);
        body.put("post_id", postId);
        body.put("text", text);
        body.put("emotions", emotions);
        body.put("hashtags", hashtags);
        body.put("mentions", mentions);
        body.put("tid", time.slot());
        return JsonReplies.createdId("/comment", http.post("/comment", body));
    }

    @Override
    public long share(long actorId, long postId, String text, List<String> emotions, SlotTime time)
            throws GatewayException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", actorId);
        body.put("post_id", postId);
        body.put("text", text);
        body.put("emotions", emotions);
        body.put("hashtags", List.of());
        body.put("mentions", List.of());
        body.put("tid", time.slot());
        return JsonReplies.createdId("/share", http.post("/share", body));
    }

    @Override
    public void react(long actorId, long postId, String reaction, SlotTime time) throws GatewayException {
        http.post("/reaction", Map.of("user_id", actorId, "post_id", postId, "type", reaction, "tid", time.slot()));
    }

    @Override
    public void castVote(long actorId, long postId, String preference, SlotTime time) throws GatewayException {
        http.post("/cast_preference",
                Map.of("user_id", actorId, "post_id", postId, "vote", preference, "tid", time.slot()));
    }

    @Override
    public void follow(long followerId, long followeeId, SlotTime time) throws GatewayException {
        followAction(followerId, followeeId, "follow", time);
    }

    @Override
    public void unfollow(long followerId, long followeeId, SlotTime time) throws GatewayException {
        followAction(followerId, followeeId, "unfollow", time);
    }

    private void followAction(long followerId, long followeeId, String action, SlotTime time)
            throws GatewayException {
        http.post("/follow", Map.of("user_id", followerId, "target", followeeId, "action", action,
                "tid", time.slot()));
    }

    @Override
    public String getPostText(long postId) throws GatewayException {
        JsonElement reply = http.post("/get_post", Map.of("post_id", postId));
        if (reply.isJsonObject() && reply.getAsJsonObject().has("text")) {
            return JsonReplies.text("/get_post", reply, "text");
        }
        return JsonReplies.text("/get_post", reply, "tweet");
    }

    @Override
    public List<String> getThread(long postId, int maxLength) throws GatewayException {
        List<String> thread = JsonReplies.strings("/post_thread", http.post("/post_thread", Map.of("post_id", postId)));
        if (maxLength > 0 && thread.size() > maxLength) {
            return thread.subList(thread.size() - maxLength, thread.size());
        }
        return thread;
    }

    @Override
    public long authorOf(long postId) throws GatewayException {
        long author = JsonReplies.createdId("/get_user_from_post",
                http.post("/get_user_from_post", Map.of("post_id", postId)));
        if (author < 0) {
            throw new GatewayException("No author known for post " + postId);
        }
        return author;
    }

    @Override
    public List<String> updateInterests(long actorId, List<Long> postIds, int attentionWindow, SlotTime time)
            throws GatewayException {
        if (!postIds.isEmpty()) {
            http.post("/set_user_interests",
                    Map.of("user_id", actorId, "post_ids", postIds, "round", time.slot()));
        }
        return JsonReplies.strings("/get_user_interests", http.post("/get_user_interests",
                Map.of("user_id", actorId, "round_id", time.slot(), "time_window", attentionWindow)));
    }

    @Override
    public void churn(long actorId, SlotTime time) throws GatewayException {
        http.post("/churn", Map.of("user_id", actorId, "left_on", time.slot()));
    }
}
