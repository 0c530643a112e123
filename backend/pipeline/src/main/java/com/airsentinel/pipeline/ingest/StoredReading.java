package com.airsentinel.pipeline.ingest;

import com.airsentinel.core.model.EnrichedReading;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record StoredReading(
        @JsonProperty("id") long id,
        @JsonProperty("reading") EnrichedReading reading
) {
    public StoredReading {
        Objects.requireNonNull(reading, "reading is required");
    }
}
