package com.norma.orchestration.api;

import com.norma.orchestration.model.StepDispatch;
import com.norma.orchestration.state.ExecutionState;

/**
 * Runs the step under the plan cursor. Quality is judged elsewhere.
 */
public interface StepExecutionService {

    /**
     * Invokes the handler for the current step with a timeout and bounded retries. A usable or
     * {@code not_found} result marks the step done and advances the cursor; a failure yields an
     * {@code error} result and leaves the cursor in place.
     *
     * @param state the session state; its plan must not be exhausted
     * @return the dispatched step and its result
     */
    StepDispatch dispatch(ExecutionState state);
}
