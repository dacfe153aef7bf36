package com.norma.orchestration.exception;

public class ToolException extends OrchestrationException {

    public ToolException(String message) {
        super(message);
    }

    public ToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
