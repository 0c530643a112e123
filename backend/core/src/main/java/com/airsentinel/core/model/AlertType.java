package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertType {
    HIGH_CO2,
    CRITICAL_RISK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("alert type is required");
        }
        return AlertType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
