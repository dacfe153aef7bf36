package com.norma.orchestration.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable copy of a session's state, taken when it is handed to an operator.
 *
 * @param currentStepIndex cursor into {@code steps}, or {@code null} when the plan is exhausted
 */
public record ExecutionSnapshot(
        UUID sessionId,
        String query,
        SessionStatus status,
        String goal,
        int planVersion,
        List<PlanStep> steps,
        Integer currentStepIndex,
        Map<String, Object> scratchpad,
        List<ExecutionHistoryEntry> history,
        int dispatchCount,
        int replanCount,
        Instant capturedAt
) {

    public ExecutionSnapshot {
        steps = steps == null ? List.of() : List.copyOf(steps);
        scratchpad = scratchpad == null ? Map.of() : Map.copyOf(scratchpad);
        history = history == null ? List.of() : List.copyOf(history);
    }
}
