package org.ysim.runtime.dispatch;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.model.ActionResult;

/**
 * Writes one JSON line per action result to the {@value #LOGGER_NAME} logger.
 * <p>
 * The logging configuration routes that logger to its own rolling file; with the logger disabled
 * the recorder costs a level check per action.
 */
public class TelemetryRecorder {

    public static final String LOGGER_NAME = "ysim.telemetry";

    private static final Logger TELEMETRY = LoggerFactory.getLogger(LOGGER_NAME);

    private final Gson gson = new Gson();
    private final boolean enabled;

    /**
     * @param enabled whether results are written at all ({@code telemetry.enabled})
     */
    public TelemetryRecorder(boolean enabled) {
        this.enabled = enabled;
    }

    public void record(ActionResult result) {
        if (enabled && TELEMETRY.isInfoEnabled()) {
            TELEMETRY.info(toJson(result));
        }
    }

    String toJson(ActionResult result) {
        JsonObject json = new JsonObject();
        json.addProperty("actor", result.actorId());
        json.addProperty("name", result.actorName());
        json.addProperty("action", result.kind().configKey());
        json.addProperty("slot", result.slot());
        json.addProperty("day", result.day());
        json.addProperty("hour", result.hour());
        json.addProperty("phase", result.boundary() ? "day-boundary" : "slot");
        json.addProperty("status", result.status().name());
        json.addProperty("durationMs", result.durationNanos() / 1_000_000.0);
        json.addProperty("attempts", result.attempts());
        if (result.error() != null) {
            json.addProperty("error", result.error());
        }
        return gson.toJson(json);
    }
}
