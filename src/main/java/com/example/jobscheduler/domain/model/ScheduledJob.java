package com.example.jobscheduler.domain.model;

import com.example.jobscheduler.domain.enums.JobStatus;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * In-memory representation of a schedulable unit of work.
 * <p>
 * Instances held by the job store are mutated only under the store's lock.
 * Everything handed out of the store is a {@link #copy()}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ScheduledJob {

    private UUID id;

    /**
     * Earliest instant at which the job may be dispatched
     */
    private Instant runAt;

    /**
     * Opaque blob handed verbatim to the job handler
     */
    private String payload;

    private JobStatus status;

    /**
     * Number of attempts that ended in failure so far
     */
    @Builder.Default
    private int retries = 0;

    private boolean recurring;

    /**
     * Delay between a successful run of a recurring job and its next run
     */
    @Builder.Default
    private Duration interval = Duration.ZERO;

    private String lastError;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Time of the most recent successful run
     */
    private Instant completedAt;

    public ScheduledJob copy() {
        return toBuilder().build();
    }

    /**
     * Check if the job may be dispatched at the given instant
     */
    public boolean isDue(Instant now) {
        return status != null && status.isDispatchable() && !runAt.isAfter(now);
    }

    @Override
    public String toString() {
        return String.format("ScheduledJob{id=%s, status=%s, runAt=%s, retries=%d, recurring=%s}",
                id, status, runAt, retries, recurring);
    }
}
