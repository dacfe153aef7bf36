package com.norma.orchestration.model;

/**
 * The step as it was when dispatched, with what the tool returned.
 */
public record StepDispatch(PlanStep step, StepResult result) {
}
