package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * External view of a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private Instant runAt;
    private String payload;
    private JobStatus status;
    private Integer retries;
    private Boolean recurring;
    private Double intervalSeconds;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
}
