package com.airsentinel.pipeline.broadcast;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.HeartbeatEmitted;
import com.airsentinel.core.feature.FeatureExtractor;
import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.RawReading;
import com.airsentinel.core.model.StreamSettings;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class HeartbeatTask {
    private static final Logger LOGGER = Logger.getLogger(HeartbeatTask.class.getName());
    private static final long MIN_CHECK_PERIOD_MILLIS = 50;

    private final BroadcastHub hub;
    private final FeatureExtractor extractor;
    private final StreamSettings settings;
    private final Clock clock;
    private final EventBus eventBus;
    private final Random random;

    private ScheduledExecutorService timerExecutor;

    public HeartbeatTask(BroadcastHub hub, FeatureExtractor extractor, StreamSettings settings, Clock clock, EventBus eventBus) {
        this(hub, extractor, settings, clock, eventBus, new Random());
    }

    HeartbeatTask(
            BroadcastHub hub,
            FeatureExtractor extractor,
            StreamSettings settings,
            Clock clock,
            EventBus eventBus,
            Random random
    ) {
        this.hub = Objects.requireNonNull(hub, "hub is required");
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.random = Objects.requireNonNull(random, "random is required");
    }

    public synchronized void start() {
        if (timerExecutor != null) {
            return;
        }
        long periodMillis = Math.max(MIN_CHECK_PERIOD_MILLIS, settings.heartbeatCadence().toMillis() / 4);
        timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        timerExecutor.scheduleAtFixedRate(this::safeTick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Heartbeat started with cadence " + settings.heartbeatCadence());
    }

    public synchronized void stop() {
        if (timerExecutor == null) {
            return;
        }
        timerExecutor.shutdownNow();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        timerExecutor = null;
    }

    public synchronized boolean isRunning() {
        return timerExecutor != null;
    }

    public Optional<EnrichedReading> tick() {
        if (hub.sinceLastPublish().compareTo(settings.heartbeatCadence()) < 0) {
            return Optional.empty();
        }
        EnrichedReading synthetic = synthesize();
        if (!hub.publishIfQuiet(synthetic, settings.heartbeatCadence())) {
            return Optional.empty();
        }
        eventBus.publish(new HeartbeatEmitted(clock.instant(), synthetic.source(), synthetic.co2Ppm()));
        return Optional.of(synthetic);
    }

    EnrichedReading synthesize() {
        Optional<EnrichedReading> last = hub.lastRealReading();
        double base = last.map(EnrichedReading::co2Ppm).orElse(settings.fallbackPpm());
        String source = last.map(EnrichedReading::source).orElse(settings.fallbackSource());
        String location = last.map(EnrichedReading::location).orElse(null);

        double jitter = (random.nextDouble() * 2.0 - 1.0) * settings.jitterPpm();
        double co2 = Math.round(Math.max(0.0, base + jitter) * 100.0) / 100.0;
        RawReading raw = new RawReading(source, co2, location, clock.millis() / 1000.0);
        return extractor.score(raw, false, true);
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Heartbeat tick failed", e);
        }
    }
}
