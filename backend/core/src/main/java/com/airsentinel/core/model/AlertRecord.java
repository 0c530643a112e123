package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record AlertRecord(
        @JsonProperty("id") String id,
        @JsonProperty("type") AlertType type,
        @JsonProperty("source") String source,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("message") String message,
        @JsonProperty("resolved") boolean resolved,
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("resolved_at") Double resolvedAt
) {
    public AlertRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(message, "message is required");
    }

    public AlertRecord resolve(double resolvedAtEpochSeconds) {
        return new AlertRecord(id, type, source, severity, message, true, timestamp, resolvedAtEpochSeconds);
    }
}
