package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param allowRejected when true the replanner may reuse approaches listed in
 *                      {@code rejected_sources}
 */
public record ReplanInstructions(
        @JsonProperty("strategy") ReplanStrategy strategy,
        @JsonProperty("details") String details,
        @JsonProperty("allow_rejected") boolean allowRejected
) {

    public ReplanInstructions {
        if (strategy == null) {
            throw new IllegalArgumentException("replan strategy is required");
        }
        details = details == null ? "" : details;
    }

    public static ReplanInstructions of(ReplanStrategy strategy, String details) {
        return new ReplanInstructions(strategy, details, false);
    }
}
