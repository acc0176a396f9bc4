package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatistics {

    private Map<String, Long> statusDistribution;
    private long queueDepth;
    private long inFlight;
    private long pendingWrites;
    private Instant generatedAt;
}
