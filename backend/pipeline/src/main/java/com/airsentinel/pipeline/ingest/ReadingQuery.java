package com.airsentinel.pipeline.ingest;

import java.util.Objects;
import java.util.Optional;

public record ReadingQuery(Optional<String> source, double sinceEpochSeconds, int limit, int offset) {
    public static final int MAX_LIMIT = 500;

    public ReadingQuery {
        Objects.requireNonNull(source, "source is required");
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public static ReadingQuery latest(int limit) {
        return new ReadingQuery(Optional.empty(), Double.NEGATIVE_INFINITY, limit, 0);
    }

    public boolean matches(StoredReading stored) {
        if (stored.reading().timestamp() < sinceEpochSeconds) {
            return false;
        }
        return source.isEmpty() || source.get().equals(stored.reading().source());
    }
}
