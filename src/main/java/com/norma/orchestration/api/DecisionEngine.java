package com.norma.orchestration.api;

import com.norma.orchestration.model.Decision;
import com.norma.orchestration.model.StepDispatch;
import com.norma.orchestration.state.ExecutionState;

/**
 * Judges the latest dispatch. Implementations are deterministic and read the state without
 * changing it; the caller merges the decision's scratchpad update and routes on its verdict.
 */
public interface DecisionEngine {

    Decision decide(ExecutionState state, StepDispatch dispatch);
}
