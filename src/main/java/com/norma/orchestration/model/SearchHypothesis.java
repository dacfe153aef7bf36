package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchHypothesis(
        @JsonProperty("hypothesis") String hypothesis,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("expected_documents") List<String> expectedDocuments
) {
}
