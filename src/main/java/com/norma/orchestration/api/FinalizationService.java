package com.norma.orchestration.api;

import com.norma.orchestration.model.FinalAnswer;
import com.norma.orchestration.state.ExecutionState;

public interface FinalizationService {

    /**
     * Builds the answer from history and scratchpad and completes the session. Citations come
     * from usable step results whose documents were not rejected, never from model output.
     */
    FinalAnswer finalizeAnswer(ExecutionState state);
}
