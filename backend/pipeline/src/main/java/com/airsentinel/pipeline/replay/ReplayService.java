package com.airsentinel.pipeline.replay;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.ReplayCompleted;
import com.airsentinel.core.model.ValidationException;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.pipeline.ingest.IngestionGateway;
import com.airsentinel.pipeline.ingest.RawReadingPayload;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

public class ReplayService {
    private static final Logger LOGGER = Logger.getLogger(ReplayService.class.getName());

    private final IngestionGateway gateway;
    private final EventBus eventBus;
    private final Clock clock;

    public ReplayService(IngestionGateway gateway, EventBus eventBus, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public ReplayReport replay(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return replay(file.toString(), reader.lines().toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading replay log " + file, e);
        }
    }

    public ReplayReport replay(String origin, List<String> lines) {
        int ingested = 0;
        int malformed = 0;
        int rejected = 0;
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            RawReadingPayload payload;
            try {
                payload = JsonUtils.objectMapper().readValue(line, RawReadingPayload.class);
            } catch (JsonProcessingException e) {
                malformed++;
                LOGGER.warning("Skipping malformed line " + lineNumber + " in " + origin + ": " + e.getOriginalMessage());
                continue;
            }
            try {
                gateway.ingest(payload);
                ingested++;
            } catch (ValidationException e) {
                rejected++;
                LOGGER.warning("Rejected line " + lineNumber + " in " + origin + ": " + e.getMessage());
            }
        }
        ReplayReport report = new ReplayReport(origin, ingested, malformed, rejected);
        eventBus.publish(new ReplayCompleted(clock.instant(), origin, ingested, malformed, rejected));
        LOGGER.info("Replayed " + origin + ": ingested=" + ingested + " malformed=" + malformed + " rejected=" + rejected);
        return report;
    }
}
