package org.ysim.client;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.spi.GatewayException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Posts JSON bodies to an HTTP service and parses JSON answers.
 * <p>
 * Every request is bounded by the configured timeout. Failures are classified for the
 * dispatcher's retry policy: timeouts, broken connections and 5xx answers are transient,
 * any other non-2xx answer is permanent. Thread-safe.
 */
public final class HttpJsonClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpJsonClient.class);
    private static final Gson GSON = new Gson();

    private final HttpClient client;
    private final String baseUrl;
    private final Duration timeout;
    private final Map<String, String> headers;

    /**
     * @param baseUrl service root, with or without a trailing slash
     * @param timeout bound of connection setup and of every request
     */
    public HttpJsonClient(String baseUrl, Duration timeout) {
        this(baseUrl, timeout, Map.of());
    }

    /**
     * @param baseUrl service root, with or without a trailing slash
     * @param timeout bound of connection setup and of every request
     * @param headers extra headers sent with every request (for example an authorization header)
     */
    public HttpJsonClient(String baseUrl, Duration timeout, Map<String, String> headers) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.headers = Map.copyOf(headers);
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Posts a body and returns the parsed answer.
     *
     * @param path endpoint path, starting with {@code /}
     * @param body object serialized with Gson, or {@code null} for an empty body
     * @return the parsed answer, {@link JsonNull} for an empty one
     * @throws GatewayException on timeout, transport failure, a non-2xx status or malformed JSON
     */
    public JsonElement post(String path, Object body) throws GatewayException {
        String url = baseUrl + path;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(GSON.toJson(body)));
        headers.forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw GatewayException.timeout("Timed out after " + timeout.toMillis() + " ms calling " + url, e);
        } catch (IOException e) {
            throw GatewayException.transientFailure("I/O failure calling " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted while calling " + url, e);
        }

        int status = response.statusCode();
        if (status >= 500) {
            throw GatewayException.transientFailure("HTTP " + status + " from " + url, null);
        }
        if (status < 200 || status >= 300) {
            throw new GatewayException("HTTP " + status + " from " + url + ": " + abbreviate(response.body()));
        }
        return parse(url, response.body());
    }

    private static JsonElement parse(String url, String text) throws GatewayException {
        if (text == null || text.isBlank()) {
            return JsonNull.INSTANCE;
        }
        try {
            return JsonParser.parseString(text);
        } catch (JsonParseException e) {
            LOG.debug("Unparseable answer from {}: {}", url, abbreviate(text));
            throw new GatewayException("Malformed JSON from " + url, e);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
