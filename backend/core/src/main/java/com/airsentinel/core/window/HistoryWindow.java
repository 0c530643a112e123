package com.airsentinel.core.window;

// Not thread-safe: callers serialize access per source.
public final class HistoryWindow {
    private final double[] values;
    private int head;
    private int size;
    private double sum;

    public HistoryWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.values = new double[capacity];
    }

    public void push(double value) {
        if (size == values.length) {
            sum -= values[head];
        } else {
            size++;
        }
        values[head] = value;
        sum += value;
        head = (head + 1) % values.length;
    }

    public WindowStats stats() {
        if (size == 0) {
            return WindowStats.EMPTY;
        }
        double mean = sum / size;
        double squares = 0.0;
        for (int i = 0; i < size; i++) {
            double delta = values[i] - mean;
            squares += delta * delta;
        }
        return new WindowStats(mean, Math.sqrt(squares / size), size);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }
}
