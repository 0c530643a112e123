package com.airsentinel.core.events;

import java.time.Instant;

public record PersistenceFailed(
        Instant timestamp,
        String source,
        String target,
        String error
) implements Event {
    @Override
    public String type() {
        return "PersistenceFailed";
    }
}
