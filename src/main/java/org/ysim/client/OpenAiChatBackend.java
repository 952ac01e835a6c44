package org.ysim.client;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.ysim.runtime.config.SimulationSettings.ServerSettings;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.ILanguageBackend;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ILanguageBackend} speaking the OpenAI chat-completions protocol, as served by OpenAI,
 * vLLM, Ollama and similar servers.
 */
public final class OpenAiChatBackend implements ILanguageBackend {

    private static final String ENDPOINT = "/chat/completions";

    private final HttpJsonClient http;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OpenAiChatBackend(HttpJsonClient http, String model, double temperature, int maxTokens) {
        this.http = Objects.requireNonNull(http, "http");
        this.model = Objects.requireNonNull(model, "model");
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    /**
     * Builds a backend for the configured endpoint. A non-blank API key is sent as a bearer token.
     */
    public static OpenAiChatBackend fromSettings(ServerSettings servers, Duration timeout) {
        Map<String, String> headers = servers.llmApiKey() == null || servers.llmApiKey().isBlank()
                ? Map.of()
                : Map.of("Authorization", "Bearer " + servers.llmApiKey());
        return new OpenAiChatBackend(new HttpJsonClient(servers.llmUrl(), timeout, headers),
                servers.llmModel(), servers.temperature(), servers.maxTokens());
    }

    public String getModel() {
        return model;
    }

    @Override
    public String chat(String systemPrompt, String userPrompt) throws GatewayException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        body.put("temperature", temperature);
        if (maxTokens > 0) {
            body.put("max_tokens", maxTokens);
        }
        return contentOf(http.post(ENDPOINT, body));
    }

    private static String contentOf(JsonElement reply) throws GatewayException {
        try {
            JsonArray choices = reply.getAsJsonObject().getAsJsonArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new GatewayException("Completion without choices: " + reply);
            }
            JsonObject message = choices.get(0).getAsJsonObject().getAsJsonObject("message");
            JsonElement content = message == null ? null : message.get("content");
            if (content == null || content.isJsonNull()) {
                throw new GatewayException("Completion without message content: " + reply);
            }
            return content.getAsString();
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException e) {
            throw new GatewayException("Malformed completion: " + reply, e);
        }
    }
}
