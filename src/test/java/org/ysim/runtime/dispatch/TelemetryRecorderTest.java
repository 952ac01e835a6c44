package org.ysim.runtime.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ysim.runtime.SimulationFixtures;
import org.ysim.runtime.model.ActionKind;
import org.ysim.runtime.model.ActionResult;
import org.ysim.runtime.model.ActionStatus;
import org.ysim.runtime.model.SlotTime;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@Tag("unit")
class TelemetryRecorderTest {

    @Test
    void succeededResultHasNoErrorField() {
        ActionResult result = ActionResult.succeeded(SimulationFixtures.user(4), ActionKind.READ,
                SlotTime.of(26, 24), 2_500_000L, 1);

        JsonObject json = JsonParser.parseString(new TelemetryRecorder(true).toJson(result)).getAsJsonObject();

        assertThat(json.get("actor").getAsLong()).isEqualTo(4);
        assertThat(json.get("name").getAsString()).isEqualTo("user4");
        assertThat(json.get("action").getAsString()).isEqualTo("read");
        assertThat(json.get("slot").getAsLong()).isEqualTo(26);
        assertThat(json.get("day").getAsInt()).isEqualTo(1);
        assertThat(json.get("hour").getAsInt()).isEqualTo(2);
        assertThat(json.get("phase").getAsString()).isEqualTo("slot");
        assertThat(json.get("status").getAsString()).isEqualTo("SUCCEEDED");
        assertThat(json.get("durationMs").getAsDouble()).isEqualTo(2.5);
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void failedResultCarriesError() {
        ActionResult result = ActionResult.failed(SimulationFixtures.user(4), ActionKind.POST, SlotTime.of(1, 24),
                ActionStatus.TIMED_OUT, 0L, 1, new RuntimeException("slow model"));

        JsonObject json = JsonParser.parseString(new TelemetryRecorder(true).toJson(result)).getAsJsonObject();

        assertThat(json.get("status").getAsString()).isEqualTo("TIMED_OUT");
        assertThat(json.get("error").getAsString()).isEqualTo("RuntimeException: slow model");
    }

    @Test
    void boundaryResultIsMarked() {
        ActionResult result = ActionResult.succeeded(SimulationFixtures.user(4), ActionKind.FOLLOW,
                SlotTime.of(23, 24).boundaryAfter(), 0L, 1);

        JsonObject json = JsonParser.parseString(new TelemetryRecorder(true).toJson(result)).getAsJsonObject();

        assertThat(json.get("phase").getAsString()).isEqualTo("day-boundary");
        assertThat(json.get("slot").getAsLong()).isEqualTo(23);
    }

    @Test
    void disabledRecorderAcceptsResults() {
        new TelemetryRecorder(false).record(ActionResult.skipped(SimulationFixtures.user(1), ActionKind.CAST,
                SlotTime.of(0, 24), "heavy queue full"));
    }
}
