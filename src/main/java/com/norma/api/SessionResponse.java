package com.norma.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.norma.orchestration.model.FinalAnswer;
import com.norma.orchestration.model.SessionOutcome;

import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        UUID sessionId,
        String status,
        FinalAnswer finalAnswer,
        String humanReviewReason,
        String errorMessage,
        List<HistoryEntryView> history
) {

    public static SessionResponse from(SessionOutcome outcome) {
        return new SessionResponse(
                outcome.sessionId(),
                outcome.status().name(),
                outcome.finalAnswer(),
                outcome.humanReviewRequest() == null ? null : outcome.humanReviewRequest().reason(),
                outcome.errorMessage(),
                outcome.history().stream().map(HistoryEntryView::from).toList());
    }
}
