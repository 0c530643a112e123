package com.airsentinel.pipeline.replay;

import java.nio.file.Path;
import java.time.Duration;

public record InboxCollectorConfig(String inputDir, boolean deleteProcessed, Duration interval) {
    public InboxCollectorConfig {
        if (inputDir == null || inputDir.isBlank()) {
            throw new IllegalArgumentException("inputDir is required");
        }
        interval = interval == null ? Duration.ofSeconds(2) : interval;
    }

    public Path inputPath() {
        return Path.of(inputDir);
    }
}
