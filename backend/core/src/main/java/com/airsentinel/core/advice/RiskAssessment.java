package com.airsentinel.core.advice;

import com.airsentinel.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskAssessment(
        @JsonProperty("risk_score") double riskScore,
        @JsonProperty("risk_level") Severity riskLevel,
        @JsonProperty("co2_ppm") double co2Ppm,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("message") String message
) {
}
