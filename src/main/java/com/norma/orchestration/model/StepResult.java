package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one dispatched step. Produced once, never changed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepResult(
        @JsonProperty("status") ResultStatus status,
        @JsonProperty("source") SourceRef source,
        @JsonProperty("structured_output") Map<String, Object> structuredOutput,
        @JsonProperty("summary") String summary,
        @JsonProperty("error_message") String errorMessage
) {

    public StepResult {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (structuredOutput == null || structuredOutput.isEmpty()) {
            structuredOutput = Map.of();
        } else {
            Map<String, Object> copy = new LinkedHashMap<>();
            structuredOutput.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
            structuredOutput = Collections.unmodifiableMap(copy);
        }
    }

    public static StepResult success(SourceRef source, Map<String, Object> facts, String summary) {
        return new StepResult(ResultStatus.SUCCESS, source, facts, summary, null);
    }

    public static StepResult partial(SourceRef source, Map<String, Object> facts, String summary) {
        return new StepResult(ResultStatus.PARTIAL, source, facts, summary, null);
    }

    public static StepResult notFound(String summary) {
        return new StepResult(ResultStatus.NOT_FOUND, null, Map.of(), summary, null);
    }

    public static StepResult error(String message) {
        return new StepResult(ResultStatus.ERROR, null, Map.of(), null, message);
    }
}
