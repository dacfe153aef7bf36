package com.norma.orchestration.exception;

/**
 * An infrastructure dependency, usually the language model provider, could not be reached.
 */
public class ServiceUnavailableException extends OrchestrationException {

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
