package com.norma.api;

public record CancelSessionResponse(
        String status,
        String message
) {
    public static CancelSessionResponse success() {
        return new CancelSessionResponse("success", "Session cancellation requested.");
    }

    public static CancelSessionResponse notFound() {
        return new CancelSessionResponse("not-found", "Session not running.");
    }
}
