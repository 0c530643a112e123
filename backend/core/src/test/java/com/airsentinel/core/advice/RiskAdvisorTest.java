package com.airsentinel.core.advice;

import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.Severity;
import com.airsentinel.core.model.Thresholds;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class RiskAdvisorTest {
    private final RiskAdvisor advisor = new RiskAdvisor(Thresholds.defaults());

    @Test
    void everyTierHasMessageAndRecommendation() {
        for (Severity severity : Severity.values()) {
            assertNotNull(advisor.message(severity));
            Recommendation recommendation = advisor.recommend(severity);
            assertNotNull(recommendation);
            assertFalse(recommendation.actions().isEmpty());
        }
    }

    @Test
    void urgencyRisesWithSeverity() {
        assertEquals("low", advisor.recommend(Severity.SAFE).urgency());
        assertEquals("medium", advisor.recommend(Severity.WARNING).urgency());
        assertEquals("high", advisor.recommend(Severity.DANGER).urgency());
    }

    @Test
    void assessmentReportsDangerThresholdAndTierMessage() {
        EnrichedReading reading = new EnrichedReading("sensor-1", 420.5, null, 1000.0, 1.0, 0.2, Severity.DANGER, false, false);

        RiskAssessment assessment = advisor.assess(reading);

        assertEquals(400.0, assessment.threshold(), 1e-9);
        assertEquals(Severity.DANGER, assessment.riskLevel());
        assertEquals(advisor.message(Severity.DANGER), assessment.message());
    }
}
