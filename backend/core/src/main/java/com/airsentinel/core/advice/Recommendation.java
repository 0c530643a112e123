package com.airsentinel.core.advice;

import java.util.List;

public record Recommendation(
        String title,
        String recommendation,
        List<String> actions,
        String urgency
) {
    public Recommendation {
        actions = List.copyOf(actions);
    }
}
