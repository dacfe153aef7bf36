package com.norma.orchestration.service;

import com.norma.entity.EscalationLog;
import com.norma.entity.HistoryEntryLog;
import com.norma.entity.PromptLog;
import com.norma.entity.QuerySession;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.HumanReviewRequest;
import com.norma.orchestration.model.PendingReview;
import com.norma.orchestration.model.SessionOutcome;
import com.norma.repository.EscalationLogRepository;
import com.norma.repository.HistoryEntryLogRepository;
import com.norma.repository.PromptLogRepository;
import com.norma.repository.QuerySessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AuditPersistenceService {

    private final QuerySessionRepository sessionRepository;
    private final PromptLogRepository promptLogRepository;
    private final HistoryEntryLogRepository historyEntryLogRepository;
    private final EscalationLogRepository escalationLogRepository;
    private final JsonProcessingService jsonProcessingService;

    public QuerySession startSession(UUID sessionId, String queryText) {
        QuerySession session = QuerySession.builder()
                .id(sessionId)
                .queryText(queryText)
                .status("PLANNING")
                .build();
        return sessionRepository.save(session);
    }

    public void logPrompt(UUID sessionId, String purpose, @Nullable String systemPrompt,
                          @Nullable String userPrompt, @Nullable String fullResponse) {
        PromptLog log = PromptLog.builder()
                .session(sessionRepository.getReferenceById(sessionId))
                .purpose(purpose)
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .fullResponse(fullResponse)
                .build();
        promptLogRepository.save(log);
    }

    public void logHistoryEntry(UUID sessionId, ExecutionHistoryEntry entry) {
        HistoryEntryLog log = HistoryEntryLog.builder()
                .session(sessionRepository.getReferenceById(sessionId))
                .sequence(entry.sequence())
                .stepNumber(entry.step().number())
                .tool(entry.step().tool().wireName())
                .resultStatus(entry.result().status().wireName())
                .verdict(entry.decision().verdict().name())
                .sourceDocument(entry.result().source() == null ? null : entry.result().source().documentName())
                .decisionJson(jsonProcessingService.toJson(entry.decision()))
                .build();
        historyEntryLogRepository.save(log);
    }

    public void logEscalation(HumanReviewRequest request) {
        EscalationLog log = EscalationLog.builder()
                .session(sessionRepository.getReferenceById(request.sessionId()))
                .reason(request.reason())
                .snapshotJson(jsonProcessingService.toJson(request.snapshot()))
                .build();
        escalationLogRepository.save(log);
    }

    public void completeSession(SessionOutcome outcome, int dispatchCount) {
        sessionRepository.findById(outcome.sessionId()).ifPresent(session -> {
            session.setStatus(outcome.status().name());
            session.setDispatchCount(dispatchCount);
            if (outcome.finalAnswer() != null) {
                session.setFinalAnswer(outcome.finalAnswer().text());
            }
            if (outcome.humanReviewRequest() != null) {
                session.setHumanReviewReason(outcome.humanReviewRequest().reason());
            }
            session.setErrorMessage(outcome.errorMessage());
            sessionRepository.save(session);
        });
    }

    @Transactional(readOnly = true)
    public List<PendingReview> findPendingReviews() {
        return escalationLogRepository.findByResolvedFalseOrderByCreatedAtAsc().stream()
                .map(escalation -> new PendingReview(
                        escalation.getId(),
                        escalation.getSession().getId(),
                        escalation.getSession().getQueryText(),
                        escalation.getReason(),
                        escalation.getCreatedAt()))
                .toList();
    }

    @Transactional
    public boolean resolveReview(UUID escalationId) {
        return escalationLogRepository.findById(escalationId)
                .map(escalation -> {
                    escalation.setResolved(true);
                    escalationLogRepository.save(escalation);
                    return true;
                })
                .orElse(false);
    }
}
