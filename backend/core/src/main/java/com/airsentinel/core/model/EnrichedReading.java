package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record EnrichedReading(
        @JsonProperty("source") String source,
        @JsonProperty("co2_ppm") double co2Ppm,
        @JsonProperty("location") String location,
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("risk_score") double riskScore,
        @JsonProperty("carbon_score") double carbonScore,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("anomaly") boolean anomaly,
        @JsonProperty("synthetic") boolean synthetic
) {
    public EnrichedReading {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(severity, "severity is required");
    }
}
