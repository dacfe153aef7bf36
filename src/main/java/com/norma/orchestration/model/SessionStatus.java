package com.norma.orchestration.model;

public enum SessionStatus {
    PLANNING,
    EXECUTING,
    JUDGING,
    FINALIZING,
    COMPLETED,
    ERROR,
    HUMAN_REVIEW;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == HUMAN_REVIEW;
    }

    /**
     * Judging is the only decision point; escalation and failure are reachable from any
     * non-terminal status.
     */
    public boolean canTransitionTo(SessionStatus next) {
        if (next == this) {
            return !isTerminal();
        }
        if (isTerminal()) {
            return false;
        }
        if (next == ERROR || next == HUMAN_REVIEW) {
            return true;
        }
        return switch (this) {
            case PLANNING -> next == EXECUTING;
            case EXECUTING -> next == JUDGING;
            case JUDGING -> next == EXECUTING || next == PLANNING || next == FINALIZING;
            case FINALIZING -> next == COMPLETED;
            default -> false;
        };
    }
}
