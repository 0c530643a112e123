package com.airsentinel.core.events;

import java.time.Instant;

public record SubscriberDropped(
        Instant timestamp,
        String subscriberId,
        String reason
) implements Event {
    @Override
    public String type() {
        return "SubscriberDropped";
    }
}
