package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Planner output as returned by the language model, before validation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDraft(
        @JsonProperty("goal") String goal,
        @JsonProperty("query_domain") String queryDomain,
        @JsonProperty("priority_documents") List<String> priorityDocuments,
        @JsonProperty("required_facts") List<String> requiredFacts,
        @JsonProperty("requires_calculation") Boolean requiresCalculation,
        @JsonProperty("calculation") CalculationTemplate calculation,
        @JsonProperty("search_hypotheses") List<SearchHypothesis> searchHypotheses,
        @JsonProperty("steps") List<StepDraft> steps
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StepDraft(
            @JsonProperty("step_number") Integer stepNumber,
            @JsonProperty("action") String action,
            @JsonProperty("tool") String tool,
            @JsonProperty("parameters") Map<String, Object> parameters,
            @JsonProperty("semantic_keywords") List<String> keywords,
            @JsonProperty("expected_documents") List<String> expectedDocuments,
            @JsonProperty("expression") String expression,
            @JsonProperty("output_variable") String outputVariable,
            @JsonProperty("input_variables") Map<String, Object> inputVariables
    ) {
    }
}
