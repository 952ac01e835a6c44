package org.ysim.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.spi.GatewayException;

import com.google.gson.JsonElement;

@Tag("unit")
class HttpJsonClientTest {

    private final FakeHttpServer server = new FakeHttpServer();

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void postsJsonAndParsesAnswer() throws Exception {
        server.reply("/echo", "{\"id\": 42}");

        JsonElement reply = server.client().post("/echo", Map.of("user_id", 3));

        assertThat(reply.getAsJsonObject().get("id").getAsLong()).isEqualTo(42L);
        FakeHttpServer.Request request = server.lastRequest("/echo");
        assertThat(request.body().getAsJsonObject().get("user_id").getAsInt()).isEqualTo(3);
        assertThat(request.headers()).containsEntry("Content-Type", "application/json");
    }

    @Test
    void blankAnswerIsJsonNull() throws Exception {
        server.handle("/empty", ctx -> ctx.result(""));

        assertThat(server.client().post("/empty", null).isJsonNull()).isTrue();
    }

    @Test
    void serverErrorIsTransient() {
        server.handle("/boom", ctx -> ctx.status(503).result("busy"));

        assertThatThrownBy(() -> server.client().post("/boom", Map.of()))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.isTransient()).isTrue();
                    assertThat(e.isTimeout()).isFalse();
                    assertThat(e).hasMessageContaining("HTTP 503");
                });
    }

    @Test
    void clientErrorIsPermanent() {
        server.handle("/missing", ctx -> ctx.status(404).result("no such post"));

        assertThatThrownBy(() -> server.client().post("/missing", Map.of()))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.isTransient()).isFalse();
                    assertThat(e).hasMessageContaining("HTTP 404").hasMessageContaining("no such post");
                });
    }

    @Test
    void slowAnswerTimesOut() {
        server.handle("/slow", ctx -> {
            Thread.sleep(1_000);
            ctx.result("{}");
        });

        assertThatThrownBy(() -> server.client(Duration.ofMillis(100)).post("/slow", Map.of()))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.isTimeout()).isTrue();
                    assertThat(e.isTransient()).isTrue();
                });
    }

    @Test
    void malformedJsonIsRejected() {
        server.reply("/garbage", "{not json");

        assertThatThrownBy(() -> server.client().post("/garbage", Map.of()))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("Malformed JSON");
    }

    @Test
    void unreachableServiceIsTransient() {
        String baseUrl = server.baseUrl();
        server.close();

        assertThatThrownBy(() -> new HttpJsonClient(baseUrl, Duration.ofSeconds(1)).post("/post", Map.of()))
                .isInstanceOfSatisfying(GatewayException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    void trailingSlashOfBaseUrlIsDropped() {
        assertThat(new HttpJsonClient("http://localhost:5010/", Duration.ofSeconds(1)).getBaseUrl())
                .isEqualTo("http://localhost:5010");
    }
}
