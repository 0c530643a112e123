package com.airsentinel.core.events;

import java.time.Instant;

public record CollectorFailed(
        Instant timestamp,
        String collectorName,
        String message
) implements Event {
    @Override
    public String type() {
        return "CollectorFailed";
    }
}
