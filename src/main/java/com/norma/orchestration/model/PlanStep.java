package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.norma.orchestration.OrchestrationConstants.PARAM_EXPECTED_DOCUMENTS;
import static com.norma.orchestration.OrchestrationConstants.PARAM_KEYWORDS;

/**
 * One unit of work in a plan. Steps are values: completing a step replaces it with a copy
 * whose status is {@link StepStatus#DONE}.
 */
public record PlanStep(
        @JsonProperty("step_number") int number,
        @JsonProperty("action") String action,
        @JsonProperty("tool") StepTool tool,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("status") StepStatus status
) {

    public PlanStep {
        if (number <= 0) {
            throw new IllegalArgumentException("step_number must be positive");
        }
        if (tool == null) {
            throw new IllegalArgumentException("tool is required");
        }
        action = action == null ? "" : action;
        parameters = copyParameters(parameters);
        status = status == null ? StepStatus.PENDING : status;
    }

    public static PlanStep pending(int number, String action, StepTool tool, Map<String, Object> parameters) {
        return new PlanStep(number, action, tool, parameters, StepStatus.PENDING);
    }

    public PlanStep markDone() {
        return new PlanStep(number, action, tool, parameters, StepStatus.DONE);
    }

    public PlanStep renumber(int newNumber) {
        return new PlanStep(newNumber, action, tool, parameters, status);
    }

    @JsonIgnore
    public boolean isDone() {
        return status == StepStatus.DONE;
    }

    @JsonIgnore
    public List<String> keywords() {
        return stringList(parameters.get(PARAM_KEYWORDS));
    }

    @JsonIgnore
    public List<String> expectedDocuments() {
        return stringList(parameters.get(PARAM_EXPECTED_DOCUMENTS));
    }

    static List<String> stringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream()
                    .filter(item -> item != null && !item.toString().isBlank())
                    .map(item -> item.toString().trim())
                    .toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.trim());
        }
        return List.of();
    }

    private static Map<String, Object> copyParameters(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
