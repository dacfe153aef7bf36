package com.norma.repository;

import com.norma.entity.QuerySession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface QuerySessionRepository extends JpaRepository<QuerySession, UUID> {
}
