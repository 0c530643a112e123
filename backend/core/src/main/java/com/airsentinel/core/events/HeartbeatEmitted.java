package com.airsentinel.core.events;

import java.time.Instant;

public record HeartbeatEmitted(
        Instant timestamp,
        String source,
        double co2Ppm
) implements Event {
    @Override
    public String type() {
        return "HeartbeatEmitted";
    }
}
