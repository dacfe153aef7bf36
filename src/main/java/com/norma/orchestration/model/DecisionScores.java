package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DecisionScores(
        @JsonProperty("source_relevance") double sourceRelevance,
        @JsonProperty("context_consistency") double contextConsistency
) {

    public DecisionScores {
        requireUnitInterval("source_relevance", sourceRelevance);
        requireUnitInterval("context_consistency", contextConsistency);
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1], was " + value);
        }
    }
}
