package com.norma.orchestration.exception;

public class PlanValidationException extends OrchestrationException {

    public PlanValidationException(String message) {
        super(message);
    }
}
