package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnomalySettings(
        @JsonProperty("windowCapacity") int windowCapacity,
        @JsonProperty("zThreshold") double zThreshold,
        @JsonProperty("minSamples") int minSamples,
        @JsonProperty("minStdDev") double minStdDev
) {
    public AnomalySettings {
        if (windowCapacity < 2) {
            throw new IllegalArgumentException("windowCapacity must be at least 2");
        }
        if (!(zThreshold > 0)) {
            throw new IllegalArgumentException("zThreshold must be positive");
        }
        if (minSamples < 2 || minSamples > windowCapacity) {
            throw new IllegalArgumentException("minSamples must be between 2 and windowCapacity");
        }
        if (!(minStdDev > 0)) {
            throw new IllegalArgumentException("minStdDev must be positive");
        }
    }

    public static AnomalySettings defaults() {
        return new AnomalySettings(20, 2.0, 5, 1.0);
    }
}
