package com.example.jobscheduler.service;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.JobStatistics;
import com.example.jobscheduler.exception.InvalidJobStateException;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.mapper.JobMapper;
import com.example.jobscheduler.service.executor.JobExecutor;
import com.example.jobscheduler.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Service for the job lifecycle operations exposed to clients.
 * <p>
 * Provides:
 * - Job submission with input validation
 * - Job lookup and listing
 * - Cancellation
 * - Statistics
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    private final JobStore jobStore;
    private final JobExecutor jobExecutor;
    private final JobMapper jobMapper;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    // === Job Creation ===

    /**
     * Submit a job that becomes due {@code delaySeconds} from now.
     *
     * @throws IllegalArgumentException if the request is invalid
     */
    public JobResponse createJob(CreateJobRequest request) {
        validate(request);

        var delay = toDuration(request.getDelaySeconds());
        var interval = toDuration(request.getIntervalSeconds());
        var runAt = clock.instant().plus(delay);

        var job = jobStore.create(runAt, request.getPayload(), request.isRecurring(), interval);
        return jobMapper.toResponse(job);
    }

    // === Job Retrieval ===

    public JobResponse getJob(UUID jobId) {
        return jobStore.get(jobId)
                .map(jobMapper::toResponse)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * List jobs ordered by run time, optionally restricted to one status
     */
    public List<JobResponse> listJobs(JobStatus status) {
        return jobMapper.toResponseList(jobStore.list(status));
    }

    // === Status Management ===

    /**
     * Cancel a scheduled job
     *
     * @throws JobNotFoundException     if the job does not exist
     * @throws InvalidJobStateException if the job is running or already finished
     */
    public JobResponse cancelJob(UUID jobId) {
        var outcome = jobStore.cancel(jobId);
        switch (outcome) {
            case NOT_FOUND -> throw new JobNotFoundException(jobId);
            case ALREADY_RUNNING -> throw new InvalidJobStateException(jobId, JobStatus.RUNNING, JobStatus.CANCELLED,
                    "running jobs cannot be cancelled");
            case ALREADY_TERMINAL -> {
                var current = jobStore.get(jobId).map(job -> job.getStatus()).orElse(null);
                throw new InvalidJobStateException(jobId, current, JobStatus.CANCELLED, "job already finished");
            }
            case CANCELLED -> log.info("Job {} cancelled by request", jobId);
        }
        return getJob(jobId);
    }

    // === Statistics ===

    public JobStatistics getStatistics() {
        var distribution = new LinkedHashMap<String, Long>();
        jobStore.countByStatus().forEach((status, count) -> distribution.put(status.getCode(), count));

        return JobStatistics.builder()
                .statusDistribution(distribution)
                .queueDepth(jobStore.queueDepth())
                .inFlight(jobExecutor.inFlight())
                .pendingWrites(jobStore.pendingWriteCount())
                .generatedAt(clock.instant())
                .build();
    }

    private void validate(CreateJobRequest request) {
        if (request.getDelaySeconds() < 0 || !Double.isFinite(request.getDelaySeconds())) {
            throw new IllegalArgumentException("Delay must be a non-negative number of seconds");
        }
        if (request.getDelaySeconds() > properties.getMaxDelaySeconds()) {
            throw new IllegalArgumentException(String.format("Delay must not exceed %d seconds",
                    properties.getMaxDelaySeconds()));
        }
        if (request.getIntervalSeconds() < 0 || !Double.isFinite(request.getIntervalSeconds())) {
            throw new IllegalArgumentException("Interval must be a non-negative number of seconds");
        }
        if (request.getIntervalSeconds() > properties.getMaxDelaySeconds()) {
            throw new IllegalArgumentException(String.format("Interval must not exceed %d seconds",
                    properties.getMaxDelaySeconds()));
        }
        if (request.getPayload() == null) {
            throw new IllegalArgumentException("Payload is required");
        }
        var payloadBytes = request.getPayload().getBytes(StandardCharsets.UTF_8).length;
        if (payloadBytes > properties.getMaxPayloadBytes()) {
            throw new IllegalArgumentException(String.format("Payload is %d bytes, the limit is %d",
                    payloadBytes, properties.getMaxPayloadBytes()));
        }
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
