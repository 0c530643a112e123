package com.airsentinel.service.api;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.CollectorFailed;
import com.airsentinel.core.events.HeartbeatEmitted;
import com.airsentinel.core.events.PersistenceFailed;
import com.airsentinel.core.events.ReadingIngested;
import com.airsentinel.core.events.ReplayCompleted;
import com.airsentinel.core.events.SubscriberDropped;
import com.airsentinel.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DiagnosticsTrackerTest {
    @Test
    void countsPipelineEventsAndAgesOutRecentReadings() {
        SteppingClock clock = new SteppingClock(Instant.parse("2026-01-01T00:00:00Z"));
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus, clock, () -> 3);

        bus.publish(new ReadingIngested(clock.instant(), "a", 450.0, Severity.DANGER, true, 1L));
        bus.publish(new ReadingIngested(clock.instant(), "a", 410.0, Severity.DANGER, false, null));
        bus.publish(new PersistenceFailed(clock.instant(), "a", "readings", "disk full"));
        bus.publish(new HeartbeatEmitted(clock.instant(), "a", 411.0));
        bus.publish(new SubscriberDropped(clock.instant(), "sub-1", "transport_error"));

        Map<String, Object> metrics = tracker.metricsSnapshot();
        assertEquals(3, metrics.get("subscribersConnected"));
        assertEquals(2L, metrics.get("readingsIngestedTotal"));
        assertEquals(1L, metrics.get("anomaliesTotal"));
        assertEquals(2, metrics.get("recentReadingsPerMinute"));
        assertEquals(1L, metrics.get("persistenceFailuresTotal"));
        assertEquals(1L, metrics.get("heartbeatsTotal"));
        assertEquals(1L, metrics.get("subscribersDroppedTotal"));

        clock.advance(Duration.ofSeconds(61));
        assertEquals(0, tracker.metricsSnapshot().get("recentReadingsPerMinute"));
        assertEquals(2L, tracker.metricsSnapshot().get("readingsIngestedTotal"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void tracksReplayAndCollectorFailureStatus() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus, Clock.systemUTC(), () -> 0);
        Instant at = Instant.parse("2026-01-01T00:00:00Z");

        bus.publish(new ReplayCompleted(at, "inbox/a.jsonl", 10, 1, 2));
        bus.publish(new CollectorFailed(at, "inboxCollector", "Collector run failed: inboxCollector - boom"));

        Map<String, Object> collectors = tracker.collectorsSnapshot();
        Map<String, Object> replay = (Map<String, Object>) collectors.get("replay");
        Map<String, Object> inbox = (Map<String, Object>) collectors.get("inboxCollector");
        assertEquals("inbox/a.jsonl", replay.get("lastOrigin"));
        assertEquals(10, replay.get("lastIngested"));
        assertEquals(3, replay.get("lastSkipped"));
        assertEquals("Collector run failed: inboxCollector - boom", inbox.get("lastErrorMessage"));
    }

    private static final class SteppingClock extends Clock {
        private final AtomicReference<Instant> now;

        private SteppingClock(Instant start) {
            this.now = new AtomicReference<>(start);
        }

        private void advance(Duration step) {
            now.updateAndGet(current -> current.plus(step));
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    }
}
