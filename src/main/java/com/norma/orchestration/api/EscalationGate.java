package com.norma.orchestration.api;

import com.norma.orchestration.model.HumanReviewRequest;
import com.norma.orchestration.state.ExecutionState;

/**
 * Hands a session to an operator. The state is frozen and no automatic resumption exists.
 */
public interface EscalationGate {

    HumanReviewRequest escalate(ExecutionState state, String reason);
}
