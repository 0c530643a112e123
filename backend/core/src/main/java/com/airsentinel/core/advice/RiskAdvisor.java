package com.airsentinel.core.advice;

import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.Severity;
import com.airsentinel.core.model.Thresholds;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class RiskAdvisor {
    private static final Map<Severity, String> MESSAGES = new EnumMap<>(Map.of(
            Severity.SAFE, "CO2 levels are within safe range. No action required.",
            Severity.WARNING, "CO2 is elevated. Consider improving ventilation.",
            Severity.DANGER, "Dangerous CO2 level detected. Take immediate action.",
            Severity.CRITICAL, "CRITICAL: CO2 is at hazardous levels. Evacuate if necessary."
    ));

    private static final Map<Severity, Recommendation> RECOMMENDATIONS = new EnumMap<>(Map.of(
            Severity.SAFE, new Recommendation(
                    "Environment is Safe",
                    "Current CO2 levels are within the safe range. This is a good time to perform preventive "
                            + "maintenance on air quality systems and maintain vegetation coverage around your facility.",
                    List.of(
                            "Monitor CO2 levels hourly.",
                            "Maintain air filtration systems.",
                            "Plant trees and increase green cover in the area.",
                            "Document baseline readings for trend analysis."
                    ),
                    "low"
            ),
            Severity.WARNING, new Recommendation(
                    "Elevated CO2 - Take Precautions",
                    "CO2 levels are moderately elevated. Increase ventilation and reduce activities that generate "
                            + "significant emissions. Notify your environmental compliance team.",
                    List.of(
                            "Increase ventilation rate by 20-30%.",
                            "Reduce high-emission activities during peak hours.",
                            "Alert the environmental management team.",
                            "Check air filtration systems for blockages.",
                            "Consider switching to cleaner energy sources."
                    ),
                    "medium"
            ),
            Severity.DANGER, new Recommendation(
                    "Dangerous CO2 Level - Act Now",
                    "CO2 concentration is at dangerous levels. Immediate action is required to protect occupants "
                            + "and comply with environmental regulations. Engage your emergency protocol.",
                    List.of(
                            "Increase ventilation to maximum immediately.",
                            "Suspend high-emission operations.",
                            "Activate emergency air quality protocol.",
                            "Notify regulatory authorities if threshold exceeds legal limit.",
                            "Move sensitive populations away from exposure areas.",
                            "Engage backup air purification systems."
                    ),
                    "high"
            ),
            Severity.CRITICAL, new Recommendation(
                    "CRITICAL: Emergency Response Required",
                    "CO2 is at hazardous levels posing an immediate risk to human health and ecosystems. "
                            + "Activate full emergency response and report to environmental agencies immediately.",
                    List.of(
                            "Evacuate the affected zone immediately.",
                            "Shut down all emission sources.",
                            "Activate the emergency reporting protocol.",
                            "Deploy mobile air purification units.",
                            "Initiate mandatory incident reporting.",
                            "Issue public health advisory."
                    ),
                    "critical"
            )
    ));

    private final Thresholds thresholds;

    public RiskAdvisor(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public RiskAssessment assess(EnrichedReading reading) {
        return new RiskAssessment(
                reading.riskScore(),
                reading.severity(),
                reading.co2Ppm(),
                thresholds.dangerPpm(),
                message(reading.severity())
        );
    }

    public String message(Severity severity) {
        return MESSAGES.get(severity);
    }

    public Recommendation recommend(Severity severity) {
        return RECOMMENDATIONS.get(severity);
    }
}
