package com.norma.api;

import com.norma.orchestration.api.SessionAuditService;
import com.norma.orchestration.model.PendingReview;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
class ReviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionAuditService auditService;

    @Test
    void testPendingReviews() throws Exception {
        PendingReview review = new PendingReview(UUID.randomUUID(), UUID.randomUUID(),
                "Minimum concrete cover for slabs?", "Loop detected twice", OffsetDateTime.now());
        when(auditService.findPendingReviews()).thenReturn(List.of(review));

        mockMvc.perform(get("/api/reviews"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].reason").value("Loop detected twice"))
                .andExpect(jsonPath("$[0].query").value("Minimum concrete cover for slabs?"));
    }

    @Test
    void testResolve() throws Exception {
        UUID escalationId = UUID.randomUUID();
        when(auditService.resolveReview(escalationId)).thenReturn(true);

        mockMvc.perform(post("/api/reviews/{escalationId}/resolve", escalationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        mockMvc.perform(post("/api/reviews/{escalationId}/resolve", UUID.randomUUID()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not-found"));
    }
}
