package com.airsentinel.core.alert;

import com.airsentinel.core.model.AlertRecord;
import com.airsentinel.core.model.AlertType;
import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.Severity;
import com.airsentinel.core.model.Thresholds;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Edge-triggered alerting per (source, alert type). A record is raised when a
 * condition starts to hold and the same record is resolved when it stops;
 * readings in between produce nothing.
 *
 * <p>Evaluation for one source must be serialized by the caller. Reads of the
 * active set are safe from any thread.
 */
public final class AlertEvaluator {
    private static final Logger LOGGER = Logger.getLogger(AlertEvaluator.class.getName());

    private final Thresholds thresholds;
    private final Supplier<String> idGenerator;
    private final Map<AlertKey, AlertRecord> active = new ConcurrentHashMap<>();

    public AlertEvaluator(Thresholds thresholds) {
        this(thresholds, () -> UUID.randomUUID().toString());
    }

    public AlertEvaluator(Thresholds thresholds, Supplier<String> idGenerator) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator is required");
    }

    public List<AlertRecord> evaluate(EnrichedReading reading) {
        if (reading.synthetic()) {
            return List.of();
        }
        List<AlertRecord> transitions = new ArrayList<>(2);
        for (AlertType type : AlertType.values()) {
            AlertKey key = new AlertKey(reading.source(), type);
            boolean holds = conditionHolds(type, reading);
            AlertRecord current = active.get(key);
            if (holds && current == null) {
                AlertRecord raised = raise(type, reading);
                active.put(key, raised);
                transitions.add(raised);
                LOGGER.warning("Alert raised: " + type.wireName() + " source=" + reading.source()
                        + " co2=" + reading.co2Ppm());
            } else if (!holds && current != null) {
                AlertRecord resolved = current.resolve(reading.timestamp());
                active.remove(key);
                transitions.add(resolved);
                LOGGER.info("Alert resolved: " + type.wireName() + " source=" + reading.source());
            }
        }
        return transitions;
    }

    public List<AlertRecord> activeAlerts() {
        List<AlertRecord> snapshot = new ArrayList<>(active.values());
        snapshot.sort(Comparator.comparingDouble(AlertRecord::timestamp));
        return snapshot;
    }

    public boolean isActive(String source, AlertType type) {
        return active.containsKey(new AlertKey(source, type));
    }

    private boolean conditionHolds(AlertType type, EnrichedReading reading) {
        return switch (type) {
            case HIGH_CO2 -> reading.co2Ppm() >= thresholds.dangerPpm();
            case CRITICAL_RISK -> reading.riskScore() >= thresholds.criticalRiskCutoff();
        };
    }

    private AlertRecord raise(AlertType type, EnrichedReading reading) {
        return switch (type) {
            case HIGH_CO2 -> new AlertRecord(
                    idGenerator.get(),
                    type,
                    reading.source(),
                    reading.severity() == Severity.CRITICAL ? Severity.CRITICAL : Severity.WARNING,
                    String.format(Locale.ROOT,
                            "CO2 level at %.1f ppm from '%s' exceeds safe threshold (%.1f ppm). Risk score: %.2f.",
                            reading.co2Ppm(), reading.source(), thresholds.dangerPpm(), reading.riskScore()),
                    false,
                    reading.timestamp(),
                    null
            );
            case CRITICAL_RISK -> new AlertRecord(
                    idGenerator.get(),
                    type,
                    reading.source(),
                    Severity.CRITICAL,
                    String.format(Locale.ROOT,
                            "Risk score %.2f from '%s' is critically high. Immediate action required.",
                            reading.riskScore(), reading.source()),
                    false,
                    reading.timestamp(),
                    null
            );
        };
    }

    private record AlertKey(String source, AlertType type) {
    }
}
