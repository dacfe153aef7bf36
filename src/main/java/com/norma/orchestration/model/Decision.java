package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The judge's verdict on the latest step. Construction enforces the schema: verdict,
 * reasoning and scores are required, REPLAN carries instructions and HUMAN_REVIEW
 * carries a reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
        @JsonProperty("verdict") Verdict verdict,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("scores") DecisionScores scores,
        @JsonProperty("contradiction_details") String contradictionDetails,
        @JsonProperty("is_loop_detected") boolean loopDetected,
        @JsonProperty("replan_instructions") ReplanInstructions replanInstructions,
        @JsonProperty("scratchpad_update") ScratchpadUpdate scratchpadUpdate,
        @JsonProperty("human_review_reason") String humanReviewReason
) {

    public Decision {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict is required");
        }
        if (reasoning == null || reasoning.isBlank()) {
            throw new IllegalArgumentException("reasoning is required");
        }
        if (scores == null) {
            throw new IllegalArgumentException("scores are required");
        }
        if (verdict == Verdict.REPLAN && replanInstructions == null) {
            throw new IllegalArgumentException("REPLAN requires replan_instructions");
        }
        if (verdict == Verdict.HUMAN_REVIEW && (humanReviewReason == null || humanReviewReason.isBlank())) {
            throw new IllegalArgumentException("HUMAN_REVIEW requires human_review_reason");
        }
        if (scratchpadUpdate == null) {
            scratchpadUpdate = ScratchpadUpdate.EMPTY;
        }
    }

    public ReplanStrategy strategy() {
        return replanInstructions == null ? null : replanInstructions.strategy();
    }
}
