package com.airsentinel.pipeline.answer;

import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.ValidationException;
import com.airsentinel.pipeline.broadcast.BroadcastHub;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AssistantService {
    public static final int MIN_QUESTION_LENGTH = 3;
    public static final int MAX_QUESTION_LENGTH = 2000;
    private static final Logger LOGGER = Logger.getLogger(AssistantService.class.getName());

    private final AnsweringService answeringService;
    private final BroadcastHub hub;
    private final Clock clock;

    public AssistantService(AnsweringService answeringService, BroadcastHub hub, Clock clock) {
        this.answeringService = Objects.requireNonNull(answeringService, "answeringService is required");
        this.hub = Objects.requireNonNull(hub, "hub is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public Answer ask(String question) {
        String normalized = question == null ? "" : question.strip();
        if (normalized.length() < MIN_QUESTION_LENGTH || normalized.length() > MAX_QUESTION_LENGTH) {
            throw new ValidationException(
                    "query",
                    "query must be between " + MIN_QUESTION_LENGTH + " and " + MAX_QUESTION_LENGTH + " characters"
            );
        }
        Optional<EnrichedReading> live = hub.lastRealReading();
        Double liveCo2 = live.map(EnrichedReading::co2Ppm).orElse(null);
        long startedAt = clock.millis();
        try {
            return answeringService.answer(normalized, liveCo2);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Answering service unavailable, returning fallback answer", e);
            return fallback(live, clock.millis() - startedAt);
        }
    }

    static Answer fallback(Optional<EnrichedReading> live, long elapsedMillis) {
        String text = live
                .map(reading -> String.format(
                        Locale.ROOT,
                        "The assistant is unavailable right now. Latest CO2 reading from '%s' is %.1f ppm (%s, risk score %.2f).",
                        reading.source(),
                        reading.co2Ppm(),
                        reading.severity().wireName(),
                        reading.riskScore()))
                .orElse("The assistant is unavailable right now. No live CO2 reading has been received yet.");
        return new Answer(text, List.of(), elapsedMillis);
    }
}
