package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PipelineSettings(
        @JsonProperty("thresholds") Thresholds thresholds,
        @JsonProperty("anomaly") AnomalySettings anomaly,
        @JsonProperty("stream") StreamSettings stream
) {
    public PipelineSettings {
        thresholds = thresholds == null ? Thresholds.defaults() : thresholds;
        anomaly = anomaly == null ? AnomalySettings.defaults() : anomaly;
        stream = stream == null ? StreamSettings.defaults() : stream;
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(Thresholds.defaults(), AnomalySettings.defaults(), StreamSettings.defaults());
    }
}
