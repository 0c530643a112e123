package com.airsentinel.pipeline.ingest;

import com.airsentinel.core.model.EnrichedReading;

import java.util.List;
import java.util.Optional;

public interface ReadingStore {
    long append(EnrichedReading reading);

    // Newest first.
    List<StoredReading> query(ReadingQuery query);

    Optional<StoredReading> findById(long id);

    default Optional<StoredReading> latest() {
        List<StoredReading> newest = query(ReadingQuery.latest(1));
        return newest.isEmpty() ? Optional.empty() : Optional.of(newest.get(0));
    }
}
