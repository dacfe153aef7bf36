package com.norma.repository;

import com.norma.entity.PromptLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PromptLogRepository extends JpaRepository<PromptLog, UUID> {
}
