package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Thresholds(
        @JsonProperty("warningPpm") double warningPpm,
        @JsonProperty("dangerPpm") double dangerPpm,
        @JsonProperty("criticalPpm") double criticalPpm,
        @JsonProperty("baselinePpm") double baselinePpm,
        @JsonProperty("criticalRiskCutoff") double criticalRiskCutoff
) {
    public Thresholds {
        if (!(warningPpm > 0 && warningPpm < dangerPpm && dangerPpm < criticalPpm)) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 < warning < danger < critical, got "
                            + warningPpm + "/" + dangerPpm + "/" + criticalPpm);
        }
        if (!(baselinePpm > 0)) {
            throw new IllegalArgumentException("baselinePpm must be positive");
        }
        if (!(criticalRiskCutoff > 0 && criticalRiskCutoff <= 1.0)) {
            throw new IllegalArgumentException("criticalRiskCutoff must be in (0, 1]");
        }
    }

    public static Thresholds defaults() {
        return new Thresholds(350.0, 400.0, 500.0, 350.0, 0.9);
    }
}
