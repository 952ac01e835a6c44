package org.ysim.client;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.ysim.runtime.spi.GatewayException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Readers for the answer shapes of the content service.
 * <p>
 * The service answers "nothing found" with an object carrying a {@code status} field instead
 * of an empty collection; all list readers map that to an empty result.
 */
final class JsonReplies {

    private JsonReplies() {
    }

    /**
     * Reads a list of post ids: a JSON array of numbers or of objects with an {@code id} or
     * {@code post_id} field, a single such object, or a status object.
     */
    static List<Long> ids(String endpoint, JsonElement reply) throws GatewayException {
        if (reply == null || reply.isJsonNull()) {
            return List.of();
        }
        if (reply.isJsonArray()) {
            JsonArray array = reply.getAsJsonArray();
            List<Long> ids = new ArrayList<>(array.size());
            for (JsonElement element : array) {
                ids.add(id(endpoint, element));
            }
            return Collections.unmodifiableList(ids);
        }
        if (reply.isJsonObject() && isStatusOnly(reply.getAsJsonObject())) {
            return List.of();
        }
        return List.of(id(endpoint, reply));
    }

    /**
     * Reads the id of a created or referenced entity, or {@code -1} when the answer carries none.
     */
    static long createdId(String endpoint, JsonElement reply) throws GatewayException {
        if (reply == null || reply.isJsonNull()) {
            return -1L;
        }
        if (reply.isJsonObject()) {
            JsonObject object = reply.getAsJsonObject();
            if (!object.has("id") && !object.has("post_id")) {
                return -1L;
            }
        }
        return id(endpoint, reply);
    }

    /**
     * Reads a map of candidate ids to scores from a JSON object.
     */
    static Map<Long, Double> scores(String endpoint, JsonElement reply) throws GatewayException {
        if (reply == null || reply.isJsonNull() || (reply.isJsonArray() && reply.getAsJsonArray().isEmpty())) {
            return Map.of();
        }
        if (!reply.isJsonObject()) {
            throw new GatewayException("Expected an object of scores from " + endpoint + ", got " + reply);
        }
        JsonObject object = reply.getAsJsonObject();
        if (isStatusOnly(object)) {
            return Map.of();
        }
        Map<Long, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            try {
                scores.put(Long.parseLong(entry.getKey().trim()), entry.getValue().getAsDouble());
            } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
                throw new GatewayException("Malformed score entry " + entry + " from " + endpoint, e);
            }
        }
        return Collections.unmodifiableMap(scores);
    }

    /**
     * Reads a list of strings: a JSON array of strings or of objects with a {@code topic} field.
     */
    static List<String> strings(String endpoint, JsonElement reply) throws GatewayException {
        if (reply == null || reply.isJsonNull()) {
            return List.of();
        }
        if (reply.isJsonObject() && isStatusOnly(reply.getAsJsonObject())) {
            return List.of();
        }
        if (!reply.isJsonArray()) {
            throw new GatewayException("Expected an array from " + endpoint + ", got " + reply);
        }
        List<String> values = new ArrayList<>();
        for (JsonElement element : reply.getAsJsonArray()) {
            if (element.isJsonObject() && element.getAsJsonObject().has("topic")) {
                values.add(element.getAsJsonObject().get("topic").getAsString());
            } else if (element.isJsonPrimitive()) {
                values.add(element.getAsString());
            } else {
                throw new GatewayException("Unexpected element " + element + " from " + endpoint);
            }
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Reads a text field from an object answer, or the answer itself if it is a string.
     */
    static String text(String endpoint, JsonElement reply, String field) throws GatewayException {
        if (reply != null && reply.isJsonPrimitive()) {
            return reply.getAsString();
        }
        if (reply != null && reply.isJsonObject() && reply.getAsJsonObject().has(field)) {
            return reply.getAsJsonObject().get(field).getAsString();
        }
        throw new GatewayException("Missing '" + field + "' in answer from " + endpoint + ": " + reply);
    }

    private static long id(String endpoint, JsonElement element) throws GatewayException {
        try {
            if (element.isJsonPrimitive()) {
                return element.getAsLong();
            }
            if (element.isJsonObject()) {
                JsonObject object = element.getAsJsonObject();
                if (object.has("post_id")) {
                    return object.get("post_id").getAsLong();
                }
                if (object.has("id")) {
                    return object.get("id").getAsLong();
                }
            }
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new GatewayException("Malformed id " + element + " from " + endpoint, e);
        }
        throw new GatewayException("Expected an id from " + endpoint + ", got " + element);
    }

    private static boolean isStatusOnly(JsonObject object) {
        return object.has("status") && !object.has("id") && !object.has("post_id");
    }
}
