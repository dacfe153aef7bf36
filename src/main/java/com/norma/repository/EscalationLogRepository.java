package com.norma.repository;

import com.norma.entity.EscalationLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Escalations handed to operators.
 */
@Repository
public interface EscalationLogRepository extends JpaRepository<EscalationLog, UUID> {

    /**
     * Unresolved escalations, oldest first.
     */
    List<EscalationLog> findByResolvedFalseOrderByCreatedAtAsc();
}
