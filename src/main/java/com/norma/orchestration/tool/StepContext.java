package com.norma.orchestration.tool;

import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.state.ExecutionState;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of the state a handler needs. Handlers run on the tool pool and never touch
 * the live {@link ExecutionState}.
 */
public record StepContext(
        UUID sessionId,
        String query,
        PlanStep step,
        Map<String, Object> scratchpad,
        List<ExecutionHistoryEntry> history
) {

    public static StepContext of(ExecutionState state, PlanStep step) {
        return new StepContext(state.getSessionId(), state.getQuery().text(), step,
                state.getScratchpad().asMap(), state.getHistory().entries());
    }
}
