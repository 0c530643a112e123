package com.airsentinel.core.feature;

import com.airsentinel.core.model.AnomalySettings;
import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.RawReading;
import com.airsentinel.core.model.Severity;
import com.airsentinel.core.model.Thresholds;
import com.airsentinel.core.model.ValidationException;
import com.airsentinel.core.window.HistoryWindow;
import com.airsentinel.core.window.WindowStats;

import java.util.Objects;

public final class FeatureExtractor {
    private final Thresholds thresholds;
    private final AnomalySettings anomalySettings;

    public FeatureExtractor(Thresholds thresholds, AnomalySettings anomalySettings) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
        this.anomalySettings = Objects.requireNonNull(anomalySettings, "anomalySettings is required");
    }

    public Thresholds thresholds() {
        return thresholds;
    }

    public HistoryWindow newWindow() {
        return new HistoryWindow(anomalySettings.windowCapacity());
    }

    public EnrichedReading enrich(RawReading raw, HistoryWindow history) {
        validate(raw);
        Objects.requireNonNull(history, "history is required");
        boolean anomaly = isAnomaly(raw.co2Ppm(), history.stats());
        history.push(raw.co2Ppm());
        return score(raw, anomaly, false);
    }

    // Leaves history untouched; the anomaly flag is taken as given.
    public EnrichedReading score(RawReading raw, boolean anomaly, boolean synthetic) {
        validate(raw);
        return new EnrichedReading(
                raw.source(),
                raw.co2Ppm(),
                raw.location(),
                raw.timestamp(),
                riskScore(raw.co2Ppm()),
                carbonScore(raw.co2Ppm()),
                Severity.classify(raw.co2Ppm(), thresholds),
                anomaly,
                synthetic
        );
    }

    public void validate(RawReading raw) {
        if (raw == null) {
            throw new ValidationException("reading", "reading is required");
        }
        if (raw.source().isBlank()) {
            throw new ValidationException("source", "source must not be blank");
        }
        if (!Double.isFinite(raw.co2Ppm())) {
            throw new ValidationException("co2_ppm", "co2_ppm must be a finite number");
        }
        if (raw.co2Ppm() < 0) {
            throw new ValidationException("co2_ppm", "co2_ppm must be non-negative");
        }
        if (!Double.isFinite(raw.timestamp())) {
            throw new ValidationException("timestamp", "timestamp must be a finite number");
        }
    }

    public double riskScore(double co2Ppm) {
        return Math.min(Math.max(co2Ppm, 0.0) / thresholds.dangerPpm(), 1.0);
    }

    public double carbonScore(double co2Ppm) {
        return (co2Ppm - thresholds.baselinePpm()) / thresholds.baselinePpm();
    }

    boolean isAnomaly(double co2Ppm, WindowStats stats) {
        if (stats.count() < anomalySettings.minSamples()) {
            return false;
        }
        double stdDev = Math.max(stats.stdDev(), anomalySettings.minStdDev());
        double z = (co2Ppm - stats.mean()) / stdDev;
        return Math.abs(z) > anomalySettings.zThreshold();
    }
}
