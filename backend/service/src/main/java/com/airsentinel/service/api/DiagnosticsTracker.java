package com.airsentinel.service.api;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.AlertRaised;
import com.airsentinel.core.events.AlertResolved;
import com.airsentinel.core.events.CollectorFailed;
import com.airsentinel.core.events.HeartbeatEmitted;
import com.airsentinel.core.events.PersistenceFailed;
import com.airsentinel.core.events.ReadingIngested;
import com.airsentinel.core.events.ReplayCompleted;
import com.airsentinel.core.events.SubscriberDropped;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final IntSupplier subscriberCountSupplier;
    private final LongAdder readingsIngestedTotal = new LongAdder();
    private final LongAdder anomaliesTotal = new LongAdder();
    private final LongAdder persistenceFailuresTotal = new LongAdder();
    private final LongAdder alertsRaisedTotal = new LongAdder();
    private final LongAdder alertsResolvedTotal = new LongAdder();
    private final LongAdder heartbeatsTotal = new LongAdder();
    private final LongAdder subscribersDroppedTotal = new LongAdder();
    private final ArrayDeque<Instant> recentReadingTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, CollectorStatus> collectorStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock, IntSupplier subscriberCountSupplier) {
        this.clock = clock;
        this.subscriberCountSupplier = subscriberCountSupplier;
        eventBus.subscribe(ReadingIngested.class, this::onReadingIngested);
        eventBus.subscribe(PersistenceFailed.class, event -> persistenceFailuresTotal.increment());
        eventBus.subscribe(AlertRaised.class, event -> alertsRaisedTotal.increment());
        eventBus.subscribe(AlertResolved.class, event -> alertsResolvedTotal.increment());
        eventBus.subscribe(HeartbeatEmitted.class, event -> heartbeatsTotal.increment());
        eventBus.subscribe(SubscriberDropped.class, event -> subscribersDroppedTotal.increment());
        eventBus.subscribe(ReplayCompleted.class, this::onReplayCompleted);
        eventBus.subscribe(CollectorFailed.class, this::onCollectorFailed);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("subscribersConnected", subscriberCountSupplier.getAsInt());
        metrics.put("readingsIngestedTotal", readingsIngestedTotal.longValue());
        metrics.put("anomaliesTotal", anomaliesTotal.longValue());
        metrics.put("recentReadingsPerMinute", recentReadingsPerMinute());
        metrics.put("persistenceFailuresTotal", persistenceFailuresTotal.longValue());
        metrics.put("alertsRaisedTotal", alertsRaisedTotal.longValue());
        metrics.put("alertsResolvedTotal", alertsResolvedTotal.longValue());
        metrics.put("heartbeatsTotal", heartbeatsTotal.longValue());
        metrics.put("subscribersDroppedTotal", subscribersDroppedTotal.longValue());
        metrics.put("collectors", collectorsSnapshot());
        return metrics;
    }

    public Map<String, Object> collectorsSnapshot() {
        Map<String, Object> collectors = new HashMap<>();
        for (Map.Entry<String, CollectorStatus> entry : collectorStatuses.entrySet()) {
            collectors.put(entry.getKey(), entry.getValue().toMap());
        }
        return collectors;
    }

    private void onReadingIngested(ReadingIngested event) {
        readingsIngestedTotal.increment();
        if (event.anomaly()) {
            anomaliesTotal.increment();
        }
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentReadingTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentReadingsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentReadingTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentReadingTimestamps.isEmpty()) {
            Instant first = recentReadingTimestamps.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentReadingTimestamps.removeFirst();
            } else {
                break;
            }
        }
    }

    private void onReplayCompleted(ReplayCompleted event) {
        collectorStatuses.compute("replay", (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withReplay(event.timestamp(), event.origin(), event.ingested(), event.malformed() + event.rejected());
        });
    }

    private void onCollectorFailed(CollectorFailed event) {
        collectorStatuses.compute(event.collectorName(), (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withLastErrorMessage(event.timestamp(), event.message());
        });
    }

    private record CollectorStatus(
            Instant lastRunAt,
            String lastOrigin,
            Integer lastIngested,
            Integer lastSkipped,
            String lastErrorMessage
    ) {
        private static CollectorStatus empty() {
            return new CollectorStatus(null, null, null, null, null);
        }

        private CollectorStatus withReplay(Instant runAt, String origin, int ingested, int skipped) {
            return new CollectorStatus(runAt, origin, ingested, skipped, lastErrorMessage);
        }

        private CollectorStatus withLastErrorMessage(Instant runAt, String message) {
            return new CollectorStatus(runAt, lastOrigin, lastIngested, lastSkipped, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastOrigin", lastOrigin);
            map.put("lastIngested", lastIngested);
            map.put("lastSkipped", lastSkipped);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
