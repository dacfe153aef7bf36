package com.norma.orchestration.service;

import com.norma.orchestration.model.PendingReview;
import com.norma.orchestration.model.SessionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionAuditServiceImplTest {

    private AuditPersistenceService persistenceService;
    private SessionAuditServiceImpl auditService;

    @BeforeEach
    void setUp() {
        persistenceService = mock(AuditPersistenceService.class);
        auditService = new SessionAuditServiceImpl(persistenceService);
    }

    @Test
    void testWriteFailuresDoNotPropagate() {
        UUID sessionId = UUID.randomUUID();
        DataAccessResourceFailureException outage = new DataAccessResourceFailureException("database down");
        doThrow(outage).when(persistenceService).startSession(any(), anyString());
        doThrow(outage).when(persistenceService).logPrompt(any(), anyString(), any(), any(), any());
        doThrow(outage).when(persistenceService).completeSession(any(), anyInt());

        assertDoesNotThrow(() -> auditService.startSession(sessionId, "Minimum concrete cover?"));
        assertDoesNotThrow(() -> auditService.logPrompt(sessionId, "plan", "system", "user", null));
        assertDoesNotThrow(() -> auditService.completeSession(
                SessionOutcome.failed(sessionId, "Model unavailable", List.of()), 0));

        verify(persistenceService).completeSession(any(), eq(0));
    }

    @Test
    void testReadsDelegateToPersistence() {
        UUID escalationId = UUID.randomUUID();
        PendingReview review = new PendingReview(escalationId, UUID.randomUUID(), "Minimum concrete cover?",
                "Step budget exhausted", OffsetDateTime.now());
        when(persistenceService.findPendingReviews()).thenReturn(List.of(review));
        when(persistenceService.resolveReview(escalationId)).thenReturn(true);

        assertEquals(List.of(review), auditService.findPendingReviews());
        assertTrue(auditService.resolveReview(escalationId));
        assertFalse(auditService.resolveReview(UUID.randomUUID()));
    }
}
