package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ExecutionHistoryEntry(
        @JsonProperty("sequence") int sequence,
        @JsonProperty("step") PlanStep step,
        @JsonProperty("result") StepResult result,
        @JsonProperty("decision") Decision decision,
        @JsonProperty("recorded_at") Instant recordedAt
) {

    public ExecutionHistoryEntry {
        if (step == null || result == null || decision == null) {
            throw new IllegalArgumentException("history entry needs step, result and decision");
        }
        if (recordedAt == null) {
            recordedAt = Instant.now();
        }
    }
}
