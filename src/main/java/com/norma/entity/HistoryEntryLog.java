package com.norma.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "history_entry_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoryEntryLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private QuerySession session;

    @Column(name = "sequence_no", nullable = false)
    private Integer sequence;

    @Column(name = "step_number", nullable = false)
    private Integer stepNumber;

    @Column(name = "tool", length = 20, nullable = false)
    private String tool;

    @Column(name = "result_status", length = 20, nullable = false)
    private String resultStatus;

    @Column(name = "verdict", length = 20, nullable = false)
    private String verdict;

    @Column(name = "source_document", length = 255)
    private String sourceDocument;

    @Column(name = "decision_json", columnDefinition = "TEXT")
    private String decisionJson;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
