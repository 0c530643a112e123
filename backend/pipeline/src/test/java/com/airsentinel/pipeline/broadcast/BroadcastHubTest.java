package com.airsentinel.pipeline.broadcast;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.SubscriberDropped;
import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.Severity;
import com.airsentinel.pipeline.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BroadcastHubTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final List<SubscriberDropped> dropped = new CopyOnWriteArrayList<>();
    private final EventBus eventBus = new EventBus((event, error) -> {
        throw new AssertionError("Unexpected handler error", error);
    });

    @Test
    void everySubscriberReceivesReadingsInPublishOrder() {
        BroadcastHub hub = new BroadcastHub(16, clock, eventBus);
        Subscription first = hub.subscribe();
        Subscription second = hub.subscribe();

        hub.publish(reading("R1", 410));
        hub.publish(reading("R2", 420));
        hub.publish(reading("R3", 430));

        assertEquals(List.of("R1", "R2", "R3"), locations(first.drain()));
        assertEquals(List.of("R1", "R2", "R3"), locations(second.drain()));
        assertEquals(3, hub.publishedTotal());
    }

    @Test
    void unsubscribedClientReceivesNothingFurther() {
        eventBus.subscribe(SubscriberDropped.class, dropped::add);
        BroadcastHub hub = new BroadcastHub(16, clock, eventBus);
        Subscription leaving = hub.subscribe();
        Subscription staying = hub.subscribe();

        hub.publish(reading("R1", 410));
        assertEquals(List.of("R1"), locations(leaving.drain()));
        hub.unsubscribe(leaving);
        hub.publish(reading("R2", 420));
        hub.publish(reading("R3", 430));

        assertTrue(leaving.isClosed());
        assertTrue(leaving.drain().isEmpty());
        assertEquals(List.of("R1", "R2", "R3"), locations(staying.drain()));
        assertEquals(1, hub.subscriberCount());
        assertEquals(1, dropped.size());
        assertEquals(leaving.id(), dropped.get(0).subscriberId());
        assertEquals("unsubscribed", dropped.get(0).reason());
    }

    @Test
    void unsubscribeIsIdempotent() {
        eventBus.subscribe(SubscriberDropped.class, dropped::add);
        BroadcastHub hub = new BroadcastHub(4, clock, eventBus);
        Subscription subscription = hub.subscribe();

        subscription.close();
        hub.unsubscribe(subscription, "transport_error");

        assertEquals(0, hub.subscriberCount());
        assertEquals(1, dropped.size());
        assertEquals("closed", dropped.get(0).reason());
    }

    @Test
    void fullQueueDropsOldestAndKeepsNewest() {
        BroadcastHub hub = new BroadcastHub(2, clock, eventBus);
        Subscription slow = hub.subscribe();

        hub.publish(reading("R1", 410));
        hub.publish(reading("R2", 420));
        hub.publish(reading("R3", 430));

        assertEquals(List.of("R2", "R3"), locations(slow.drain()));
        assertEquals(1, slow.droppedCount());
        assertFalse(slow.isClosed());
        assertEquals(1, hub.subscriberCount());
    }

    @Test
    void pollReturnsPublishedReadingAndTimesOutWhenIdle() throws Exception {
        BroadcastHub hub = new BroadcastHub(4, clock, eventBus);
        Subscription subscription = hub.subscribe();

        assertTrue(subscription.poll(Duration.ofMillis(10)).isEmpty());
        hub.publish(reading("R1", 410));
        Optional<EnrichedReading> next = subscription.poll(Duration.ofMillis(10));

        assertTrue(next.isPresent());
        assertEquals("R1", next.get().location());
    }

    @Test
    void closingWakesBlockedPoller() throws Exception {
        BroadcastHub hub = new BroadcastHub(4, clock, eventBus);
        Subscription subscription = hub.subscribe();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<EnrichedReading>> waiting = executor.submit(() -> subscription.poll(Duration.ofSeconds(30)));
            Thread.sleep(50);
            hub.unsubscribe(subscription);

            assertTrue(waiting.get(5, TimeUnit.SECONDS).isEmpty());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void lastRealReadingIgnoresSyntheticReadings() {
        BroadcastHub hub = new BroadcastHub(4, clock, eventBus);
        hub.publish(reading("R1", 410));
        hub.publish(new EnrichedReading("sensor-1", 999, "S", 1000, 1.0, 1.0, Severity.CRITICAL, false, true));

        assertEquals("R1", hub.lastRealReading().orElseThrow().location());
    }

    @Test
    void sinceLastPublishTracksClock() {
        BroadcastHub hub = new BroadcastHub(4, clock, eventBus);
        clock.advance(Duration.ofMillis(1500));
        assertEquals(Duration.ofMillis(1500), hub.sinceLastPublish());

        hub.publish(reading("R1", 410));
        assertEquals(Duration.ZERO, hub.sinceLastPublish());
    }

    @Test
    void concurrentSubscribeAndPublishDeliversToEveryoneWhoStayed() throws Exception {
        BroadcastHub hub = new BroadcastHub(10_000, clock, eventBus);
        Subscription early = hub.subscribe();
        int publishers = 4;
        int perPublisher = 500;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(publishers + 2);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int p = 0; p < publishers; p++) {
                String source = "sensor-" + p;
                tasks.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perPublisher; i++) {
                        hub.publish(new EnrichedReading(source, 400 + i, String.valueOf(i), i, 1.0, 0.1, Severity.DANGER, false, false));
                    }
                    return null;
                }));
            }
            tasks.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    hub.subscribe().close();
                }
                return null;
            }));
            start.countDown();
            for (Future<?> task : tasks) {
                task.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<EnrichedReading> received = early.drain();
        assertEquals(publishers * perPublisher, received.size());
        for (int p = 0; p < publishers; p++) {
            String source = "sensor-" + p;
            List<String> order = received.stream()
                    .filter(reading -> reading.source().equals(source))
                    .map(EnrichedReading::location)
                    .toList();
            for (int i = 0; i < perPublisher; i++) {
                assertEquals(String.valueOf(i), order.get(i));
            }
        }
        assertEquals(1, hub.subscriberCount());
    }

    @Test
    void quietPublishIsRefusedOnceAnotherReadingGoesOut() {
        BroadcastHub hub = new BroadcastHub(16, clock, eventBus);
        Subscription subscription = hub.subscribe();
        EnrichedReading synthetic =
                new EnrichedReading("sensor-1", 415, "HB", 1000, 1.0, 0.1, Severity.DANGER, false, true);

        clock.advance(Duration.ofSeconds(3));
        hub.publish(reading("R1", 410));
        assertFalse(hub.publishIfQuiet(synthetic, Duration.ofSeconds(2)));

        clock.advance(Duration.ofSeconds(2));
        assertTrue(hub.publishIfQuiet(synthetic, Duration.ofSeconds(2)));
        assertFalse(hub.publishIfQuiet(synthetic, Duration.ofSeconds(2)));

        assertEquals(List.of("R1", "HB"), locations(subscription.drain()));
        assertEquals("R1", hub.lastRealReading().orElseThrow().location());
    }

    private static EnrichedReading reading(String label, double co2) {
        return new EnrichedReading("sensor-1", co2, label, 1000, 1.0, 0.1, Severity.DANGER, false, false);
    }

    private static List<String> locations(List<EnrichedReading> readings) {
        return readings.stream().map(EnrichedReading::location).toList();
    }
}
