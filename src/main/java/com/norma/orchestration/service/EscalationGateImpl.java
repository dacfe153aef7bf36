package com.norma.orchestration.service;

import com.norma.orchestration.api.EscalationGate;
import com.norma.orchestration.api.SessionAuditService;
import com.norma.orchestration.model.HumanReviewRequest;
import com.norma.orchestration.model.SessionStatus;
import com.norma.orchestration.state.ExecutionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class EscalationGateImpl implements EscalationGate {

    private final SessionAuditService auditService;

    @Override
    public HumanReviewRequest escalate(ExecutionState state, String reason) {
        if (!state.isFrozen() && !state.getStatus().isTerminal()) {
            state.setStatus(SessionStatus.HUMAN_REVIEW);
        }
        state.freeze();
        HumanReviewRequest request = new HumanReviewRequest(state.getSessionId(), reason, state.snapshot());
        auditService.logEscalation(request);
        log.warn("Session {} escalated for human review after {} dispatches: {}", state.getSessionId(),
                state.getDispatchCount(), reason);
        return request;
    }
}
