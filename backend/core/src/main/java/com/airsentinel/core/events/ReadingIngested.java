package com.airsentinel.core.events;

import com.airsentinel.core.model.Severity;

import java.time.Instant;

public record ReadingIngested(
        Instant timestamp,
        String source,
        double co2Ppm,
        Severity severity,
        boolean anomaly,
        Long readingId
) implements Event {
    @Override
    public String type() {
        return "ReadingIngested";
    }
}
