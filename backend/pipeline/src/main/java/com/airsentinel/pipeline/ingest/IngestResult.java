package com.airsentinel.pipeline.ingest;

import com.airsentinel.core.model.AlertRecord;
import com.airsentinel.core.model.EnrichedReading;

import java.util.List;

/**
 * Outcome of one ingestion. {@code id} is null when the reading store could not
 * take the reading; the reading was still broadcast.
 */
public record IngestResult(Long id, EnrichedReading reading, List<AlertRecord> alerts) {
    public IngestResult {
        alerts = List.copyOf(alerts);
    }

    public boolean persisted() {
        return id != null;
    }
}
