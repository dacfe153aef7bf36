package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FinalAnswerDraft(
        @JsonProperty("answer") String answer,
        @JsonProperty("limitations") List<String> limitations
) {
}
