package com.norma.orchestration.exception;

/**
 * Base type for failures raised inside the orchestration loop.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
