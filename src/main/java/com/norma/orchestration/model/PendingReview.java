package com.norma.orchestration.model;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * An unresolved escalation as shown to operators.
 */
public record PendingReview(
        UUID escalationId,
        UUID sessionId,
        String query,
        String reason,
        OffsetDateTime escalatedAt
) {
}
