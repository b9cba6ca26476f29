package com.govcomms.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Audit row for one fetch-ingest-render cycle of one source.
 */
@Entity
@Table(name = "ingestion_cycles", indexes = {
    @Index(name = "idx_cycles_source_id", columnList = "source_id"),
    @Index(name = "idx_cycles_state", columnList = "state"),
    @Index(name = "idx_cycles_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 30)
    @Builder.Default
    private CycleState state = CycleState.IDLE;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "new_count", nullable = false)
    @Builder.Default
    private Integer newCount = 0;

    @Column(name = "skipped_count", nullable = false)
    @Builder.Default
    private Integer skippedCount = 0;

    @Column(name = "warning_count", nullable = false)
    @Builder.Default
    private Integer warningCount = 0;

    @Column(name = "dry_run", nullable = false)
    @Builder.Default
    private Boolean dryRun = false;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum CycleState {
        IDLE,
        FETCHING,
        FETCH_FAILED,
        FETCH_OK,
        INGESTING,
        INGEST_OK,
        INGEST_FAILED,
        STALENESS_CHECK,
        RENDER_SKIPPED,
        RENDERING,
        RENDER_OK,
        RENDER_FAILED,
        SKIPPED_BUSY;

        public boolean isFailure() {
            return this == FETCH_FAILED || this == INGEST_FAILED || this == RENDER_FAILED;
        }
    }
}
