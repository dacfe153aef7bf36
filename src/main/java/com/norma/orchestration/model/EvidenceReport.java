package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Evidence analyzer output for one search step.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceReport(
        @JsonProperty("status") String status,
        @JsonProperty("document_name") String documentName,
        @JsonProperty("locator") String locator,
        @JsonProperty("structured_output") Map<String, Object> structuredOutput,
        @JsonProperty("summary") String summary
) {
}
