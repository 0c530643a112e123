package com.airsentinel.pipeline.broadcast;

import com.airsentinel.core.model.EnrichedReading;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

// Bounded queue; when full the oldest pending reading is dropped.
public final class Subscription implements AutoCloseable {
    private final String id;
    private final int capacity;
    private final ArrayDeque<EnrichedReading> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Consumer<Subscription> onClose;
    private boolean closed;
    private long dropped;

    Subscription(String id, int capacity, Consumer<Subscription> onClose) {
        this.id = id;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
        this.onClose = onClose;
    }

    public String id() {
        return id;
    }

    boolean offer(EnrichedReading reading) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (queue.size() == capacity) {
                queue.pollFirst();
                dropped++;
            }
            queue.addLast(reading);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next reading. Empty when the wait timed
     * out or the subscription was closed.
     */
    public Optional<EnrichedReading> poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                if (remainingNanos <= 0) {
                    return Optional.empty();
                }
                remainingNanos = notEmpty.awaitNanos(remainingNanos);
            }
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public List<EnrichedReading> drain() {
        lock.lock();
        try {
            List<EnrichedReading> pending = new ArrayList<>(queue);
            queue.clear();
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        onClose.accept(this);
    }

    void terminate() {
        lock.lock();
        try {
            closed = true;
            queue.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
