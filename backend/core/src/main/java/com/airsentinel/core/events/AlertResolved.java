package com.airsentinel.core.events;

import com.airsentinel.core.model.AlertRecord;

import java.time.Instant;

public record AlertResolved(
        Instant timestamp,
        AlertRecord alert
) implements Event {
    @Override
    public String type() {
        return "AlertResolved";
    }
}
