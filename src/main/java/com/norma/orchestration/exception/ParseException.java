package com.norma.orchestration.exception;

/**
 * Model output did not match the expected schema within the allowed attempts.
 */
public class ParseException extends OrchestrationException {

    private final String purpose;

    public ParseException(String purpose, String message) {
        super(message);
        this.purpose = purpose;
    }

    public String getPurpose() {
        return purpose;
    }
}
