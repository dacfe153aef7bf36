package com.norma.repository;

import com.norma.entity.HistoryEntryLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface HistoryEntryLogRepository extends JpaRepository<HistoryEntryLog, UUID> {
}
