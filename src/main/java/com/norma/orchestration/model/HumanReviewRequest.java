package com.norma.orchestration.model;

import java.util.UUID;

public record HumanReviewRequest(
        UUID sessionId,
        String reason,
        ExecutionSnapshot snapshot
) {
}
