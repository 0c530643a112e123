package com.airsentinel.pipeline.api;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.pipeline.replay.ReplayService;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

public record CollectorContext(
        EventBus eventBus,
        ReplayService replayService,
        Clock clock,
        Map<String, Object> config
) {
    public CollectorContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(replayService, "replayService is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(config, "config is required");
    }

    public <T> T requiredConfig(String key, Class<T> type) {
        Object value = config.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required config key: " + key);
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Config key '" + key + "' must be " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
