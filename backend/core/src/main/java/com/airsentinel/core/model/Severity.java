package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    SAFE,
    WARNING,
    DANGER,
    CRITICAL;

    // Boundary values belong to the upper tier.
    public static Severity classify(double co2Ppm, Thresholds thresholds) {
        if (co2Ppm < thresholds.warningPpm()) {
            return SAFE;
        }
        if (co2Ppm < thresholds.dangerPpm()) {
            return WARNING;
        }
        if (co2Ppm < thresholds.criticalPpm()) {
            return DANGER;
        }
        return CRITICAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("severity is required");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
