package com.norma.orchestration.service;

import com.norma.orchestration.api.SessionAuditService;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.HumanReviewRequest;
import com.norma.orchestration.model.PendingReview;
import com.norma.orchestration.model.SessionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@Slf4j
public class SessionAuditServiceImpl implements SessionAuditService {

    private final AuditPersistenceService persistenceService;

    public SessionAuditServiceImpl(AuditPersistenceService persistenceService) {
        this.persistenceService = persistenceService;
    }

    @Override
    public void startSession(UUID sessionId, String queryText) {
        try {
            persistenceService.startSession(sessionId, queryText);
        } catch (Exception ex) {
            log.debug("Failed to persist session {}: {}", sessionId, ex.getMessage());
        }
    }

    @Override
    public void logPrompt(UUID sessionId, String purpose, @Nullable String systemPrompt,
                          @Nullable String userPrompt, @Nullable String response) {
        try {
            persistenceService.logPrompt(sessionId, purpose, systemPrompt, userPrompt, response);
        } catch (Exception ex) {
            log.debug("Failed to log prompt {}: {}", purpose, ex.getMessage());
        }
    }

    @Override
    public void logHistoryEntry(UUID sessionId, ExecutionHistoryEntry entry) {
        try {
            persistenceService.logHistoryEntry(sessionId, entry);
        } catch (Exception ex) {
            log.debug("Failed to log history entry #{}: {}", entry.sequence(), ex.getMessage());
        }
    }

    @Override
    public void logEscalation(HumanReviewRequest request) {
        try {
            persistenceService.logEscalation(request);
        } catch (Exception ex) {
            log.debug("Failed to log escalation for session {}: {}", request.sessionId(), ex.getMessage());
        }
    }

    @Override
    public void completeSession(SessionOutcome outcome, int dispatchCount) {
        try {
            persistenceService.completeSession(outcome, dispatchCount);
        } catch (Exception ex) {
            log.debug("Failed to complete session {}: {}", outcome.sessionId(), ex.getMessage());
        }
    }

    @Override
    public List<PendingReview> findPendingReviews() {
        return persistenceService.findPendingReviews();
    }

    @Override
    public boolean resolveReview(UUID escalationId) {
        return persistenceService.resolveReview(escalationId);
    }
}
