package com.norma.orchestration.api;

import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.HumanReviewRequest;
import com.norma.orchestration.model.PendingReview;
import com.norma.orchestration.model.SessionOutcome;

import java.util.List;
import java.util.UUID;

/**
 * Records what a session did: prompts, history entries, escalations and the final outcome.
 * Write failures are logged and never reach the control loop.
 */
public interface SessionAuditService {

    /**
     * Persists a new session row keyed by the orchestrator's session id.
     *
     * @param sessionId id of the running session
     * @param queryText the user's question
     */
    void startSession(UUID sessionId, String queryText);

    /**
     * Stores one language model exchange.
     *
     * @param sessionId    id of the running session
     * @param purpose      request purpose, e.g. {@code plan} or {@code plan-retry}
     * @param systemPrompt system prompt sent to the model
     * @param userPrompt   rendered user prompt
     * @param response     raw model output, possibly {@code null}
     */
    void logPrompt(UUID sessionId, String purpose, String systemPrompt, String userPrompt, String response);

    /**
     * Stores a judged step together with its decision.
     */
    void logHistoryEntry(UUID sessionId, ExecutionHistoryEntry entry);

    /**
     * Stores an escalation with the frozen state snapshot.
     */
    void logEscalation(HumanReviewRequest request);

    /**
     * Updates the session row with its terminal status and answer.
     */
    void completeSession(SessionOutcome outcome, int dispatchCount);

    /**
     * Escalations nobody has resolved yet, oldest first.
     */
    List<PendingReview> findPendingReviews();

    /**
     * Marks an escalation resolved.
     *
     * @return {@code false} if no escalation with that id exists
     */
    boolean resolveReview(UUID escalationId);
}
