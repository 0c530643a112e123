package com.airsentinel.pipeline.broadcast;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.SubscriberDropped;
import com.airsentinel.core.model.EnrichedReading;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

// Per-source order holds as long as publishers for one source are serialized.
public class BroadcastHub {
    private static final Logger LOGGER = Logger.getLogger(BroadcastHub.class.getName());

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final int queueCapacity;
    private final Clock clock;
    private final EventBus eventBus;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong lastPublishedMillis;
    private final AtomicLong publishedTotal = new AtomicLong();
    private final AtomicReference<EnrichedReading> lastRealReading = new AtomicReference<>();

    public BroadcastHub(int queueCapacity, Clock clock, EventBus eventBus) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        this.queueCapacity = queueCapacity;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.lastPublishedMillis = new AtomicLong(clock.millis());
    }

    public Subscription subscribe() {
        Subscription subscription = new Subscription(
                "sub-" + sequence.incrementAndGet(),
                queueCapacity,
                closing -> unsubscribe(closing, "closed")
        );
        subscriptions.add(subscription);
        LOGGER.fine("Subscriber connected: " + subscription.id());
        return subscription;
    }

    public void publish(EnrichedReading reading) {
        Objects.requireNonNull(reading, "reading is required");
        if (!reading.synthetic()) {
            lastRealReading.set(reading);
        }
        lastPublishedMillis.set(clock.millis());
        fanOut(reading);
    }

    /**
     * Publishes only if nothing else was published for at least {@code quietFor}.
     * The check and the claim are one compare-and-set, so a publish that lands
     * in between wins and this call returns false.
     */
    public boolean publishIfQuiet(EnrichedReading reading, Duration quietFor) {
        Objects.requireNonNull(reading, "reading is required");
        long last = lastPublishedMillis.get();
        long now = clock.millis();
        if (now - last < quietFor.toMillis()) {
            return false;
        }
        if (!lastPublishedMillis.compareAndSet(last, now)) {
            return false;
        }
        if (!reading.synthetic()) {
            lastRealReading.set(reading);
        }
        fanOut(reading);
        return true;
    }

    private void fanOut(EnrichedReading reading) {
        publishedTotal.incrementAndGet();
        for (Subscription subscription : subscriptions) {
            subscription.offer(reading);
        }
    }

    public void unsubscribe(Subscription subscription) {
        unsubscribe(subscription, "unsubscribed");
    }

    public void unsubscribe(Subscription subscription, String reason) {
        // Closed before removal so a concurrent publish cannot deliver to it.
        subscription.terminate();
        if (subscriptions.remove(subscription)) {
            LOGGER.fine("Subscriber removed: " + subscription.id() + " (" + reason + ")");
            eventBus.publish(new SubscriberDropped(clock.instant(), subscription.id(), reason));
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public long publishedTotal() {
        return publishedTotal.get();
    }

    public Optional<EnrichedReading> lastRealReading() {
        return Optional.ofNullable(lastRealReading.get());
    }

    public Duration sinceLastPublish() {
        return Duration.ofMillis(Math.max(0, clock.millis() - lastPublishedMillis.get()));
    }

    public void shutdown() {
        for (Subscription subscription : subscriptions) {
            unsubscribe(subscription, "shutdown");
        }
    }
}
