package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record RawReading(
        @JsonProperty("source") String source,
        @JsonProperty("co2_ppm") double co2Ppm,
        @JsonProperty("location") String location,
        @JsonProperty("timestamp") double timestamp
) {
    public RawReading {
        Objects.requireNonNull(source, "source is required");
    }
}
