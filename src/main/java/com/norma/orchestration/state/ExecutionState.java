package com.norma.orchestration.state;

import com.norma.orchestration.model.Decision;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.ExecutionSnapshot;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.Query;
import com.norma.orchestration.model.ScratchpadUpdate;
import com.norma.orchestration.model.SessionStatus;
import com.norma.orchestration.model.StepResult;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The single mutable record of one session. Every stage reads it and every change goes
 * through the methods below, which fail once the state has been frozen.
 * <p>
 * Only the orchestration thread writes; the cancellation flag is the one field other
 * threads may set.
 */
public class ExecutionState {

    private final UUID sessionId;
    private final Query query;
    private final Scratchpad scratchpad = new Scratchpad();
    private final ExecutionHistory history = new ExecutionHistory();
    private SessionStatus status = SessionStatus.PLANNING;
    @Nullable
    private Plan plan;
    private int dispatchCount;
    private int replanCount;
    private boolean frozen;
    private volatile boolean cancelRequested;

    public ExecutionState(UUID sessionId, Query query) {
        this.sessionId = sessionId;
        this.query = query;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public Query getQuery() {
        return query;
    }

    public SessionStatus getStatus() {
        return status;
    }

    @Nullable
    public Plan getPlan() {
        return plan;
    }

    public Scratchpad getScratchpad() {
        return scratchpad;
    }

    public ExecutionHistory getHistory() {
        return history;
    }

    public int getDispatchCount() {
        return dispatchCount;
    }

    public int getReplanCount() {
        return replanCount;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Reads a value by dotted path: {@code query}, {@code status}, {@code plan.goal},
     * {@code plan.current_step_index}, {@code plan.version}, {@code scratchpad.<key>},
     * {@code history.size}, {@code dispatch_count} or {@code replan_count}.
     */
    @Nullable
    public Object get(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        if (path.startsWith("scratchpad.")) {
            return scratchpad.get(path.substring("scratchpad.".length()));
        }
        return switch (path) {
            case "query" -> query.text();
            case "status" -> status;
            case "plan.goal" -> plan == null ? null : plan.getGoal();
            case "plan.current_step_index" -> plan == null ? null : plan.currentStepIndex();
            case "plan.version" -> plan == null ? null : plan.getVersion();
            case "history.size" -> history.size();
            case "dispatch_count" -> dispatchCount;
            case "replan_count" -> replanCount;
            default -> throw new IllegalArgumentException("Unknown state path: " + path);
        };
    }

    public void setStatus(SessionStatus next) {
        ensureMutable();
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status transition " + status + " -> " + next);
        }
        status = next;
    }

    public void installPlan(Plan newPlan) {
        ensureMutable();
        if (newPlan == null) {
            throw new IllegalArgumentException("plan is required");
        }
        plan = newPlan;
    }

    public void replaceRemainingSteps(List<PlanStep> steps) {
        ensureMutable();
        if (plan == null) {
            throw new IllegalStateException("No plan installed");
        }
        plan.replaceRemaining(steps);
        replanCount++;
    }

    public void mergeScratchpad(ScratchpadUpdate update) {
        ensureMutable();
        scratchpad.apply(update);
    }

    public ExecutionHistoryEntry appendHistory(PlanStep step, StepResult result, Decision decision) {
        ensureMutable();
        ExecutionHistoryEntry entry = new ExecutionHistoryEntry(history.nextSequence(), step, result, decision, Instant.now());
        history.append(entry);
        return entry;
    }

    public void advanceStep() {
        ensureMutable();
        if (plan == null) {
            throw new IllegalStateException("No plan installed");
        }
        plan.completeCurrentStep();
    }

    public void recordDispatch() {
        ensureMutable();
        dispatchCount++;
    }

    public void freeze() {
        frozen = true;
    }

    public void requestCancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot(
                sessionId,
                query.text(),
                status,
                plan == null ? null : plan.getGoal(),
                plan == null ? 0 : plan.getVersion(),
                plan == null ? List.of() : plan.getSteps(),
                plan == null ? null : plan.currentStepIndex(),
                scratchpad.asMap(),
                history.entries(),
                dispatchCount,
                replanCount,
                Instant.now());
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Execution state of session " + sessionId + " is frozen");
        }
    }
}
