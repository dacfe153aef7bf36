package com.norma.api;

public record ResolveReviewResponse(
        String status,
        String message
) {
    public static ResolveReviewResponse success() {
        return new ResolveReviewResponse("success", "Review marked resolved.");
    }

    public static ResolveReviewResponse notFound() {
        return new ResolveReviewResponse("not-found", "Review not found.");
    }
}
