package com.norma.orchestration;

import static com.norma.orchestration.OrchestrationConstants.CANCELLED_REASON;

import com.norma.orchestration.api.DecisionEngine;
import com.norma.orchestration.api.EscalationGate;
import com.norma.orchestration.api.FinalizationService;
import com.norma.orchestration.api.PlanningService;
import com.norma.orchestration.api.SessionAuditService;
import com.norma.orchestration.api.StepExecutionService;
import com.norma.orchestration.exception.ParseException;
import com.norma.orchestration.exception.PlanValidationException;
import com.norma.orchestration.exception.ServiceUnavailableException;
import com.norma.orchestration.model.Decision;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.FinalAnswer;
import com.norma.orchestration.model.HumanReviewRequest;
import com.norma.orchestration.model.Query;
import com.norma.orchestration.model.SessionOutcome;
import com.norma.orchestration.model.SessionStatus;
import com.norma.orchestration.model.StepDispatch;
import com.norma.orchestration.service.OrchestrationMetricsService;
import com.norma.orchestration.service.SessionRegistry;
import com.norma.orchestration.state.ExecutionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Drives one session through plan, dispatch and judgment until it completes, is escalated or
 * fails. The loop never throws: every path ends in a {@link SessionOutcome}.
 */
@Service
@Slf4j
public class OrchestratorService {

    private final PlanningService planningService;
    private final StepExecutionService stepExecutionService;
    private final DecisionEngine decisionEngine;
    private final FinalizationService finalizationService;
    private final EscalationGate escalationGate;
    private final SessionAuditService auditService;
    private final SessionRegistry sessionRegistry;
    private final OrchestrationMetricsService metricsService;
    private final ExecutorService orchestrationExecutor;

    public OrchestratorService(PlanningService planningService,
                               StepExecutionService stepExecutionService,
                               DecisionEngine decisionEngine,
                               FinalizationService finalizationService,
                               EscalationGate escalationGate,
                               SessionAuditService auditService,
                               SessionRegistry sessionRegistry,
                               OrchestrationMetricsService metricsService,
                               @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor) {
        this.planningService = planningService;
        this.stepExecutionService = stepExecutionService;
        this.decisionEngine = decisionEngine;
        this.finalizationService = finalizationService;
        this.escalationGate = escalationGate;
        this.auditService = auditService;
        this.sessionRegistry = sessionRegistry;
        this.metricsService = metricsService;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    public SessionOutcome answer(Query query) {
        ExecutionState state = new ExecutionState(UUID.randomUUID(), query);
        sessionRegistry.register(state);
        return run(state);
    }

    /**
     * Starts a session on the orchestration executor and returns its id for polling.
     */
    public UUID submit(Query query) {
        ExecutionState state = new ExecutionState(UUID.randomUUID(), query);
        sessionRegistry.register(state);
        CompletableFuture.supplyAsync(() -> run(state), orchestrationExecutor)
                .exceptionally(ex -> {
                    log.error("Session {} terminated abnormally: {}", state.getSessionId(), ex.getMessage());
                    SessionOutcome failed = SessionOutcome.failed(state.getSessionId(), String.valueOf(ex.getMessage()),
                            state.getHistory().entries());
                    sessionRegistry.publish(failed);
                    return failed;
                });
        return state.getSessionId();
    }

    SessionOutcome run(ExecutionState state) {
        UUID sessionId = state.getSessionId();
        auditService.startSession(sessionId, state.getQuery().text());
        log.info("Session {} started: {}", sessionId, state.getQuery().text());
        SessionOutcome outcome;
        try {
            outcome = loop(state);
        } catch (PlanValidationException ex) {
            outcome = escalate(state, "Planning failed twice: " + ex.getMessage());
        } catch (ParseException ex) {
            outcome = escalate(state, "Model output for " + ex.getPurpose() + " could not be parsed");
        } catch (ServiceUnavailableException ex) {
            outcome = fail(state, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Session {} failed unexpectedly", sessionId, ex);
            outcome = fail(state, "Unexpected failure: " + ex.getMessage());
        }
        sessionRegistry.publish(outcome);
        auditService.completeSession(outcome, state.getDispatchCount());
        metricsService.logSummary(outcome.status());
        log.info("Session {} ended with status {} after {} dispatches and {} replans.", sessionId, outcome.status(),
                state.getDispatchCount(), state.getReplanCount());
        return outcome;
    }

    private SessionOutcome loop(ExecutionState state) {
        if (state.isCancelRequested()) {
            return escalate(state, CANCELLED_REASON);
        }
        planningService.createInitialPlan(state);
        transition(state, SessionStatus.EXECUTING);

        while (true) {
            if (state.isCancelRequested()) {
                return escalate(state, CANCELLED_REASON);
            }
            StepDispatch dispatch = stepExecutionService.dispatch(state);
            transition(state, SessionStatus.JUDGING);

            // Judge and record the dispatched step before honouring a cancellation
            Decision decision = decisionEngine.decide(state, dispatch);
            state.mergeScratchpad(decision.scratchpadUpdate());
            ExecutionHistoryEntry entry = state.appendHistory(dispatch.step(), dispatch.result(), decision);
            auditService.logHistoryEntry(state.getSessionId(), entry);
            metricsService.recordVerdict(decision.verdict());
            if (state.isCancelRequested()) {
                return escalate(state, CANCELLED_REASON);
            }

            switch (decision.verdict()) {
                case CONTINUE -> {
                    if (state.getPlan().isExhausted()) {
                        return escalate(state, "Judge asked to continue but no step is pending");
                    }
                    transition(state, SessionStatus.EXECUTING);
                }
                case REPLAN -> {
                    transition(state, SessionStatus.PLANNING);
                    if (state.isCancelRequested()) {
                        return escalate(state, CANCELLED_REASON);
                    }
                    planningService.replan(state, decision.replanInstructions());
                    transition(state, SessionStatus.EXECUTING);
                }
                case FINALIZE -> {
                    transition(state, SessionStatus.FINALIZING);
                    FinalAnswer answer = finalizationService.finalizeAnswer(state);
                    return SessionOutcome.completed(state.getSessionId(), answer, state.getHistory().entries());
                }
                case HUMAN_REVIEW -> {
                    return escalate(state, decision.humanReviewReason());
                }
            }
        }
    }

    private void transition(ExecutionState state, SessionStatus next) {
        state.setStatus(next);
        sessionRegistry.publish(SessionOutcome.running(state.getSessionId(), next));
    }

    private SessionOutcome escalate(ExecutionState state, String reason) {
        HumanReviewRequest request = escalationGate.escalate(state, reason);
        return SessionOutcome.humanReview(request);
    }

    private SessionOutcome fail(ExecutionState state, String message) {
        if (!state.isFrozen() && !state.getStatus().isTerminal()) {
            state.setStatus(SessionStatus.ERROR);
        }
        log.error("Session {} failed: {}", state.getSessionId(), message);
        return SessionOutcome.failed(state.getSessionId(), message, state.getHistory().entries());
    }
}
