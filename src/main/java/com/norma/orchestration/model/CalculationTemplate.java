package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * The formula a goal needs once its inputs are known.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalculationTemplate(
        @JsonProperty("expression") String expression,
        @JsonProperty("output_variable") String outputVariable,
        @JsonProperty("input_variables") Map<String, Object> inputVariables
) {

    public CalculationTemplate {
        inputVariables = inputVariables == null ? Map.of() : inputVariables;
    }

    public boolean isUsable() {
        return expression != null && !expression.isBlank()
                && outputVariable != null && !outputVariable.isBlank();
    }
}
