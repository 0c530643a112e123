package com.airsentinel.core.events;

import java.time.Instant;

public record ReplayCompleted(
        Instant timestamp,
        String origin,
        int ingested,
        int malformed,
        int rejected
) implements Event {
    @Override
    public String type() {
        return "ReplayCompleted";
    }
}
