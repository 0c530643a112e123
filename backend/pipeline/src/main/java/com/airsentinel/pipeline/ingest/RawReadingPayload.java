package com.airsentinel.pipeline.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RawReadingPayload(
        @JsonProperty("source") String source,
        @JsonProperty("co2_ppm") Double co2Ppm,
        @JsonProperty("location") String location,
        @JsonProperty("timestamp") Double timestamp
) {
}
