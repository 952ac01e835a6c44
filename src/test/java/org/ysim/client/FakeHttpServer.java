package org.ysim.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParser;

import io.javalin.Javalin;
import io.javalin.http.Handler;

/**
 * Embedded HTTP server answering POSTs with scripted JSON and recording every request body.
 */
public final class FakeHttpServer implements AutoCloseable {

    public record Request(String path, JsonElement body, Map<String, String> headers) {
    }

    private final Javalin app;
    private final Map<String, String> replies = new ConcurrentHashMap<>();
    private final Map<String, Handler> handlers = new ConcurrentHashMap<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private boolean stopped;

    public FakeHttpServer() {
        this.app = Javalin.create();
        app.post("/*", recording());
        app.start(0);
    }

    /**
     * Answers {@code path} with the given JSON text and status 200.
     */
    public FakeHttpServer reply(String path, String json) {
        replies.put(path, json);
        return this;
    }

    /**
     * Replaces the handler of {@code path}; the request is still recorded.
     */
    public FakeHttpServer handle(String path, Handler handler) {
        handlers.put(path, handler);
        return this;
    }

    public HttpJsonClient client() {
        return client(Duration.ofSeconds(5));
    }

    public HttpJsonClient client(Duration timeout) {
        return new HttpJsonClient(baseUrl(), timeout);
    }

    public String baseUrl() {
        return "http://localhost:" + app.port() + "/";
    }

    public List<Request> requests() {
        return requests;
    }

    public Request lastRequest(String path) {
        for (int i = requests.size() - 1; i >= 0; i--) {
            if (requests.get(i).path().equals(path)) {
                return requests.get(i);
            }
        }
        throw new AssertionError("No request to " + path + " in " + requests);
    }

    private Handler recording() {
        return ctx -> {
            record(ctx.path(), ctx.body(), ctx.headerMap());
            Handler custom = handlers.get(ctx.path());
            if (custom != null) {
                custom.handle(ctx);
                return;
            }
            ctx.contentType("application/json");
            ctx.result(replies.getOrDefault(ctx.path(), "{\"status\": 200}"));
        };
    }

    private void record(String path, String body, Map<String, String> headers) {
        JsonElement parsed = body == null || body.isBlank() ? JsonNull.INSTANCE : JsonParser.parseString(body);
        Map<String, String> names = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        names.putAll(headers);
        requests.add(new Request(path, parsed, names));
    }

    @Override
    public void close() {
        if (!stopped) {
            stopped = true;
            app.stop();
        }
    }
}
