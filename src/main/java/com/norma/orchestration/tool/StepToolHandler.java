package com.norma.orchestration.tool;

import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.model.StepTool;

/**
 * Executes steps for one tool. Implementations return {@code success}, {@code partial} or
 * {@code not_found} results and signal failure by throwing.
 */
public interface StepToolHandler {

    StepTool tool();

    /**
     * @throws com.norma.orchestration.exception.ToolException when the tool cannot produce a result
     */
    StepResult execute(StepContext context);
}
