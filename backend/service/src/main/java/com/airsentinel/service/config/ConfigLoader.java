package com.airsentinel.service.config;

import com.airsentinel.core.model.CollectorConfig;
import com.airsentinel.core.model.PipelineSettings;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.pipeline.replay.InboxCollectorConfig;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static PipelineSettings loadPipeline(Path configDir) {
        Path path = configDir.resolve("pipeline.json");
        if (!Files.exists(path)) {
            return PipelineSettings.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve("collectors.json"), new TypeReference<>() {
        });
    }

    public static InboxCollectorConfig loadInbox(Path configDir) {
        return read(configDir.resolve("inbox.json"), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
