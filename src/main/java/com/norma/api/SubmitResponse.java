package com.norma.api;

import java.time.Instant;
import java.util.UUID;

public record SubmitResponse(
        UUID sessionId,
        Instant submittedAt
) {
}
