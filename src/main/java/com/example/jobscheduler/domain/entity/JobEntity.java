package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.JobStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable row for a scheduled job.
 * <p>
 * The id is assigned by the job store, so saving an entity is an upsert keyed by id.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_job_status_run_at", columnList = "status, run_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobEntity {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "retries", nullable = false)
    private int retries;

    @Column(name = "recurring", nullable = false)
    private boolean recurring;

    /**
     * Recurrence interval in milliseconds
     */
    @Column(name = "interval_ms", nullable = false)
    private long intervalMs;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
