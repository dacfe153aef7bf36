package com.norma.orchestration.model;

import java.util.List;
import java.util.UUID;

/**
 * What a session hands back: a final answer, a human review request, or an error.
 */
public record SessionOutcome(
        UUID sessionId,
        SessionStatus status,
        FinalAnswer finalAnswer,
        HumanReviewRequest humanReviewRequest,
        String errorMessage,
        List<ExecutionHistoryEntry> history
) {

    public SessionOutcome {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static SessionOutcome completed(UUID sessionId, FinalAnswer answer, List<ExecutionHistoryEntry> history) {
        return new SessionOutcome(sessionId, SessionStatus.COMPLETED, answer, null, null, history);
    }

    public static SessionOutcome humanReview(HumanReviewRequest request) {
        return new SessionOutcome(request.sessionId(), SessionStatus.HUMAN_REVIEW, null, request, null,
                request.snapshot().history());
    }

    public static SessionOutcome failed(UUID sessionId, String message, List<ExecutionHistoryEntry> history) {
        return new SessionOutcome(sessionId, SessionStatus.ERROR, null, null, message, history);
    }

    public static SessionOutcome running(UUID sessionId, SessionStatus status) {
        return new SessionOutcome(sessionId, status, null, null, null, List.of());
    }
}
