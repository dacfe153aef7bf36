package com.norma.orchestration.api;

import com.norma.orchestration.model.ReplanInstructions;
import com.norma.orchestration.state.ExecutionState;

/**
 * Produces the initial plan and rewrites the remaining steps when the judge orders a replan.
 */
public interface PlanningService {

    /**
     * Installs the first plan and seeds the scratchpad with the query domain, priority
     * documents and search hypotheses.
     *
     * @throws com.norma.orchestration.exception.PlanValidationException if two attempts yield no valid plan
     * @throws com.norma.orchestration.exception.ParseException if the model output never matches the plan schema
     */
    void createInitialPlan(ExecutionState state);

    /**
     * Replaces the pending steps according to {@code instructions}. Done steps and history
     * are kept and the plan version increments.
     *
     * @throws com.norma.orchestration.exception.PlanValidationException if two attempts yield no valid step
     */
    void replan(ExecutionState state, ReplanInstructions instructions);
}
