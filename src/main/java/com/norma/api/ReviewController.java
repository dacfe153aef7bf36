package com.norma.api;

import com.norma.orchestration.api.SessionAuditService;
import com.norma.orchestration.model.PendingReview;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private final SessionAuditService auditService;

    public ReviewController(SessionAuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping
    public List<PendingReview> pending() {
        return auditService.findPendingReviews();
    }

    @PostMapping("/{escalationId}/resolve")
    public ResolveReviewResponse resolve(@PathVariable UUID escalationId) {
        boolean resolved = auditService.resolveReview(escalationId);
        return resolved ? ResolveReviewResponse.success() : ResolveReviewResponse.notFound();
    }
}
