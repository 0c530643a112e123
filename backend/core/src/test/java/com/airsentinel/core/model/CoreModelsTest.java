package com.airsentinel.core.model;

import com.airsentinel.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CoreModelsTest {
    @Test
    void enrichedReadingSerializesWithSnakeCaseAndLowercaseSeverity() throws Exception {
        EnrichedReading reading = new EnrichedReading("sensor-1", 420.5, "Lab", 1000.0, 1.0, 0.2, Severity.DANGER, false, false);

        JsonNode json = JsonUtils.objectMapper().valueToTree(reading);

        assertEquals(420.5, json.get("co2_ppm").asDouble(), 1e-9);
        assertEquals(1.0, json.get("risk_score").asDouble(), 1e-9);
        assertEquals("danger", json.get("severity").asText());
        assertFalse(json.get("synthetic").asBoolean());
    }

    @Test
    void alertRecordOmitsResolvedAtUntilResolved() {
        AlertRecord raised = new AlertRecord("a-1", AlertType.HIGH_CO2, "sensor-1", Severity.WARNING, "msg", false, 1000.0, null);

        JsonNode open = JsonUtils.objectMapper().valueToTree(raised);
        JsonNode closed = JsonUtils.objectMapper().valueToTree(raised.resolve(1010.0));

        assertFalse(open.has("resolved_at"));
        assertEquals("high_co2", open.get("type").asText());
        assertEquals(1010.0, closed.get("resolved_at").asDouble(), 1e-9);
        assertEquals("a-1", closed.get("id").asText());
    }

    @Test
    void severityParsesWireNamesCaseInsensitively() {
        assertEquals(Severity.CRITICAL, Severity.fromWireName(" Critical "));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromWireName("extreme"));
    }

    @Test
    void thresholdsRejectNonIncreasingTiers() {
        assertThrows(IllegalArgumentException.class, () -> new Thresholds(400, 350, 500, 350, 0.9));
        assertThrows(IllegalArgumentException.class, () -> new Thresholds(0, 400, 500, 350, 0.9));
        assertThrows(IllegalArgumentException.class, () -> new Thresholds(350, 400, 500, 350, 1.5));
    }

    @Test
    void pipelineSettingsFillMissingSectionsWithDefaults() throws Exception {
        PipelineSettings settings = JsonUtils.objectMapper().readValue(
                "{\"stream\":{\"heartbeatCadence\":\"PT1S\",\"subscriberQueueCapacity\":8,\"jitterPpm\":2.0,"
                        + "\"fallbackPpm\":410.0,\"keepAlive\":\"PT5S\"}}",
                PipelineSettings.class
        );

        assertEquals(Thresholds.defaults(), settings.thresholds());
        assertEquals(AnomalySettings.defaults(), settings.anomaly());
        assertEquals(Duration.ofSeconds(1), settings.stream().heartbeatCadence());
        assertEquals(8, settings.stream().subscriberQueueCapacity());
        assertEquals("live-sensor", settings.stream().fallbackSource());
    }
}
