package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Objects;

public record StreamSettings(
        @JsonProperty("heartbeatCadence") Duration heartbeatCadence,
        @JsonProperty("subscriberQueueCapacity") int subscriberQueueCapacity,
        @JsonProperty("jitterPpm") double jitterPpm,
        @JsonProperty("fallbackSource") String fallbackSource,
        @JsonProperty("fallbackPpm") double fallbackPpm,
        @JsonProperty("keepAlive") Duration keepAlive
) {
    public StreamSettings {
        Objects.requireNonNull(heartbeatCadence, "heartbeatCadence is required");
        Objects.requireNonNull(keepAlive, "keepAlive is required");
        if (heartbeatCadence.isZero() || heartbeatCadence.isNegative()) {
            throw new IllegalArgumentException("heartbeatCadence must be positive");
        }
        if (subscriberQueueCapacity < 1) {
            throw new IllegalArgumentException("subscriberQueueCapacity must be at least 1");
        }
        if (jitterPpm < 0 || fallbackPpm < 0) {
            throw new IllegalArgumentException("jitterPpm and fallbackPpm must not be negative");
        }
        if (fallbackSource == null || fallbackSource.isBlank()) {
            fallbackSource = "live-sensor";
        }
    }

    public static StreamSettings defaults() {
        return new StreamSettings(Duration.ofSeconds(2), 64, 5.0, "live-sensor", 415.0, Duration.ofSeconds(15));
    }
}
