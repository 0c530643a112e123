package com.airsentinel.pipeline.ingest;

import com.airsentinel.core.alert.AlertEvaluator;
import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.AlertRaised;
import com.airsentinel.core.events.AlertResolved;
import com.airsentinel.core.events.PersistenceFailed;
import com.airsentinel.core.events.ReadingIngested;
import com.airsentinel.core.feature.FeatureExtractor;
import com.airsentinel.core.model.AlertRecord;
import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.RawReading;
import com.airsentinel.core.model.ValidationException;
import com.airsentinel.core.window.HistoryWindow;
import com.airsentinel.pipeline.broadcast.BroadcastHub;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

// One lock per source; a source's readings are handled in arrival order.
public class IngestionGateway {
    private static final Logger LOGGER = Logger.getLogger(IngestionGateway.class.getName());
    static final Duration DEFAULT_LANE_IDLE_TIMEOUT = Duration.ofHours(1);

    private final FeatureExtractor extractor;
    private final AlertEvaluator alertEvaluator;
    private final BroadcastHub hub;
    private final ReadingStore readingStore;
    private final AlertSink alertSink;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<String, SourceLane> lanes = new ConcurrentHashMap<>();
    private final long laneIdleTimeoutMillis;
    private final AtomicLong nextSweepMillis;

    public IngestionGateway(
            FeatureExtractor extractor,
            AlertEvaluator alertEvaluator,
            BroadcastHub hub,
            ReadingStore readingStore,
            AlertSink alertSink,
            EventBus eventBus,
            Clock clock
    ) {
        this(extractor, alertEvaluator, hub, readingStore, alertSink, eventBus, clock, DEFAULT_LANE_IDLE_TIMEOUT);
    }

    public IngestionGateway(
            FeatureExtractor extractor,
            AlertEvaluator alertEvaluator,
            BroadcastHub hub,
            ReadingStore readingStore,
            AlertSink alertSink,
            EventBus eventBus,
            Clock clock,
            Duration laneIdleTimeout
    ) {
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.alertEvaluator = Objects.requireNonNull(alertEvaluator, "alertEvaluator is required");
        this.hub = Objects.requireNonNull(hub, "hub is required");
        this.readingStore = Objects.requireNonNull(readingStore, "readingStore is required");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        if (laneIdleTimeout.isZero() || laneIdleTimeout.isNegative()) {
            throw new IllegalArgumentException("laneIdleTimeout must be positive");
        }
        this.laneIdleTimeoutMillis = laneIdleTimeout.toMillis();
        this.nextSweepMillis = new AtomicLong(clock.millis() + laneIdleTimeoutMillis);
    }

    public IngestResult ingest(RawReadingPayload payload) {
        return ingest(normalize(payload));
    }

    public IngestResult ingest(RawReading raw) {
        extractor.validate(raw);
        evictIdleLanesIfDue();
        while (true) {
            SourceLane lane = lanes.computeIfAbsent(raw.source(), ignored -> new SourceLane(extractor.newWindow(), clock.millis()));
            lane.lock.lock();
            try {
                if (lane.retired) {
                    continue;
                }
                lane.lastSeenMillis = clock.millis();
                return ingestLocked(raw, lane);
            } finally {
                lane.lock.unlock();
            }
        }
    }

    private IngestResult ingestLocked(RawReading raw, SourceLane lane) {
        EnrichedReading reading = extractor.enrich(raw, lane.history);
        List<AlertRecord> transitions = alertEvaluator.evaluate(reading);
        hub.publish(reading);
        Long id = persist(reading);
        for (AlertRecord alert : transitions) {
            recordAlert(alert);
        }
        eventBus.publish(new ReadingIngested(
                clock.instant(),
                reading.source(),
                reading.co2Ppm(),
                reading.severity(),
                reading.anomaly(),
                id
        ));
        return new IngestResult(id, reading, transitions);
    }

    public RawReading normalize(RawReadingPayload payload) {
        if (payload == null) {
            throw new ValidationException("reading", "reading is required");
        }
        String source = payload.source() == null ? "" : payload.source().trim();
        if (source.isEmpty()) {
            throw new ValidationException("source", "source is required");
        }
        if (payload.co2Ppm() == null) {
            throw new ValidationException("co2_ppm", "co2_ppm is required");
        }
        String location = payload.location() == null || payload.location().isBlank()
                ? null
                : payload.location().trim();
        double timestamp = payload.timestamp() == null ? clock.millis() / 1000.0 : payload.timestamp();
        RawReading raw = new RawReading(source, payload.co2Ppm(), location, timestamp);
        extractor.validate(raw);
        return raw;
    }

    public int trackedSources() {
        return lanes.size();
    }

    private Long persist(EnrichedReading reading) {
        try {
            return readingStore.append(reading);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Reading store unavailable; reading from " + reading.source()
                    + " was broadcast but not persisted", e);
            eventBus.publish(new PersistenceFailed(clock.instant(), reading.source(), "readings", e.getMessage()));
            return null;
        }
    }

    private void recordAlert(AlertRecord alert) {
        try {
            alertSink.append(alert);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Alert sink unavailable; alert " + alert.id() + " not recorded", e);
            eventBus.publish(new PersistenceFailed(clock.instant(), alert.source(), "alerts", e.getMessage()));
        }
        if (alert.resolved()) {
            eventBus.publish(new AlertResolved(clock.instant(), alert));
        } else {
            eventBus.publish(new AlertRaised(clock.instant(), alert));
        }
    }

    // Idle sources lose their lane, and with it their history window.
    private void evictIdleLanesIfDue() {
        long now = clock.millis();
        long due = nextSweepMillis.get();
        if (now < due || !nextSweepMillis.compareAndSet(due, now + laneIdleTimeoutMillis)) {
            return;
        }
        long cutoff = now - laneIdleTimeoutMillis;
        for (Map.Entry<String, SourceLane> entry : lanes.entrySet()) {
            SourceLane lane = entry.getValue();
            if (lane.lastSeenMillis > cutoff || !lane.lock.tryLock()) {
                continue;
            }
            try {
                if (lane.lastSeenMillis <= cutoff) {
                    lane.retired = true;
                    lanes.remove(entry.getKey(), lane);
                    LOGGER.fine("Evicted idle source lane: " + entry.getKey());
                }
            } finally {
                lane.lock.unlock();
            }
        }
    }

    private static final class SourceLane {
        private final ReentrantLock lock = new ReentrantLock();
        private final HistoryWindow history;
        private volatile long lastSeenMillis;
        private volatile boolean retired;

        private SourceLane(HistoryWindow history, long createdMillis) {
            this.history = history;
            this.lastSeenMillis = createdMillis;
        }
    }
}
