package com.airsentinel.core.window;

public record WindowStats(double mean, double stdDev, int count) {
    public static final WindowStats EMPTY = new WindowStats(0.0, 0.0, 0);
}
