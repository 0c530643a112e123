package com.airsentinel.pipeline.answer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Answer(
        @JsonProperty("answer") String answer,
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("latency_ms") double latencyMs
) {
    public Answer {
        answer = answer == null ? "" : answer.strip();
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
