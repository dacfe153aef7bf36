package com.norma.repository;

import com.norma.entity.EscalationLog;
import com.norma.entity.QuerySession;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EscalationLogRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private QuerySessionRepository querySessionRepository;

    @Autowired
    private EscalationLogRepository escalationLogRepository;

    @Test
    void testFindUnresolved() {
        QuerySession session = querySessionRepository.saveAndFlush(QuerySession.builder()
                .id(UUID.randomUUID())
                .queryText("Anchorage length of a 16 mm bar?")
                .status("HUMAN_REVIEW")
                .build());
        escalationLogRepository.saveAndFlush(EscalationLog.builder()
                .session(session)
                .reason("Loop detected twice")
                .build());
        escalationLogRepository.saveAndFlush(EscalationLog.builder()
                .session(session)
                .reason("Step budget exhausted")
                .resolved(true)
                .build());

        List<EscalationLog> pending = escalationLogRepository.findByResolvedFalseOrderByCreatedAtAsc();

        assertEquals(1, pending.size());
        assertEquals("Loop detected twice", pending.get(0).getReason());
        assertEquals(session.getId(), pending.get(0).getSession().getId());
    }
}
