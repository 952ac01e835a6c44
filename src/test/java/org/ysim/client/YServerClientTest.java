package org.ysim.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.SimulationFixtures;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.GatewayException;

import com.google.gson.JsonObject;

@Tag("unit")
class YServerClientTest {

    private static final SlotTime TIME = SlotTime.of(30, 24);

    private final FakeHttpServer server = new FakeHttpServer();
    private final YServerClient client = new YServerClient(server.client());

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void registerSendsProfile() throws Exception {
        client.register(SimulationFixtures.user(7), 2);

        JsonObject body = server.lastRequest("/register").body().getAsJsonObject();
        assertThat(body.get("user_id").getAsLong()).isEqualTo(7L);
        assertThat(body.get("name").getAsString()).isEqualTo("user7");
        assertThat(body.get("user_type").getAsString()).isEqualTo("user");
        assertThat(body.get("is_page").getAsInt()).isZero();
        assertThat(body.get("leaning").getAsString()).isEqualTo("Democrat");
        assertThat(body.get("joined_on").getAsInt()).isEqualTo(2);
        assertThat(body.getAsJsonArray("interests")).hasSize(2);
        assertThat(body.has("feed_url")).isFalse();
    }

    @Test
    void registerMarksPagesAndSendsFeed() throws Exception {
        client.register(SimulationFixtures.page(3), 0);

        JsonObject body = server.lastRequest("/register").body().getAsJsonObject();
        assertThat(body.get("is_page").getAsInt()).isEqualTo(1);
        assertThat(body.get("user_type").getAsString()).isEqualTo("page");
        assertThat(body.get("feed_url").getAsString()).isEqualTo("https://news.example.org/feed3");
    }

    @Test
    void updateTimeSendsDayAndHour() throws Exception {
        client.updateTime(TIME);

        JsonObject body = server.lastRequest("/update_time").body().getAsJsonObject();
        assertThat(body.get("day").getAsInt()).isEqualTo(1);
        assertThat(body.get("round").getAsInt()).isEqualTo(6);
    }

    @Test
    void publishPostReturnsCreatedId() throws Exception {
        server.reply("/post", "{\"id\": 17}");

        long id = client.publishPost(4, "Hello #vote", List.of("#vote"), List.of(), List.of("joy"), TIME);

        assertThat(id).isEqualTo(17L);
        JsonObject body = server.lastRequest("/post").body().getAsJsonObject();
        assertThat(body.get("tweet").getAsString()).isEqualTo("Hello #vote");
        assertThat(body.get("tid").getAsLong()).isEqualTo(30L);
        assertThat(body.getAsJsonArray("hashtags").get(0).getAsString()).isEqualTo("#vote");
    }

    @Test
    void publishWithoutIdAnswerYieldsMinusOne() throws Exception {
        assertThat(client.publishPost(4, "text", List.of(), List.of(), List.of(), TIME)).isEqualTo(-1L);
    }

    @Test
    void articleJoinsTitleAndSummary() throws Exception {
        server.reply("/news", "{\"post_id\": 9}");

        long id = client.publishArticle(2, "Rates rise", "Banks react", "https://x.example/1", List.of(), TIME);

        assertThat(id).isEqualTo(9L);
        JsonObject body = server.lastRequest("/news").body().getAsJsonObject();
        assertThat(body.get("tweet").getAsString()).isEqualTo("Rates rise: Banks react");
        assertThat(body.get("link").getAsString()).isEqualTo("https://x.example/1");
    }

    @Test
    void followAndUnfollowShareEndpoint() throws Exception {
        client.follow(1, 2, TIME);
        client.unfollow(1, 3, TIME);

        JsonObject body = server.lastRequest("/follow").body().getAsJsonObject();
        assertThat(body.get("action").getAsString()).isEqualTo("unfollow");
        assertThat(body.get("target").getAsLong()).isEqualTo(3L);
        assertThat(server.requests()).filteredOn(r -> r.path().equals("/follow")).hasSize(2);
    }

    @Test
    void postTextPrefersTextField() throws Exception {
        server.reply("/get_post", "{\"text\": \"plain\", \"tweet\": \"other\"}");
        assertThat(client.getPostText(5)).isEqualTo("plain");

        server.reply("/get_post", "{\"tweet\": \"legacy\"}");
        assertThat(client.getPostText(5)).isEqualTo("legacy");
    }

    @Test
    void threadIsCutToItsNewestPosts() throws Exception {
        server.reply("/post_thread", "[\"a\", \"b\", \"c\", \"d\"]");

        assertThat(client.getThread(5, 2)).containsExactly("c", "d");
        assertThat(client.getThread(5, 0)).containsExactly("a", "b", "c", "d");
    }

    @Test
    void unknownAuthorIsAFailure() {
        server.reply("/get_user_from_post", "{\"status\": 404}");

        assertThatThrownBy(() -> client.authorOf(99))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("post 99");
    }

    @Test
    void interestsAreStoredThenRead() throws Exception {
        server.reply("/get_user_interests", "[{\"topic\": \"economy\"}, \"sports\"]");

        List<String> interests = client.updateInterests(4, List.of(10L, 11L), 12, TIME);

        assertThat(interests).containsExactly("economy", "sports");
        JsonObject stored = server.lastRequest("/set_user_interests").body().getAsJsonObject();
        assertThat(stored.getAsJsonArray("post_ids")).hasSize(2);
        JsonObject read = server.lastRequest("/get_user_interests").body().getAsJsonObject();
        assertThat(read.get("time_window").getAsInt()).isEqualTo(12);
    }

    @Test
    void interestsWithoutPostsSkipTheUpdate() throws Exception {
        client.updateInterests(4, List.of(), 12, TIME);

        assertThat(server.requests()).extracting(FakeHttpServer.Request::path)
                .containsExactly("/get_user_interests");
    }

    @Test
    void churnAndResetUseTheirEndpoints() throws Exception {
        client.reset();
        client.churn(6, TIME);

        assertThat(server.lastRequest("/reset").body().isJsonNull()).isTrue();
        assertThat(server.lastRequest("/churn").body().getAsJsonObject().get("left_on").getAsLong()).isEqualTo(30L);
    }
}
