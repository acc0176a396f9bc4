package com.example.jobscheduler.controller;

import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.dto.ApiResponse;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.JobStatistics;
import com.example.jobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for job operations.
 * <p>
 * Provides endpoints for:
 * - Submitting jobs
 * - Retrieving and listing jobs
 * - Cancelling jobs
 * - Statistics and health
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Management", description = "APIs for submitting and managing scheduled jobs")
public class JobController {

    private final JobManagementService jobManagementService;

    @PostMapping
    @Operation(summary = "Submit a job", description = "Schedule a one-off or recurring job after a delay")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job request (delay: {}s, recurring: {}, interval: {}s)",
                request.getDelaySeconds(), request.isRecurring(), request.getIntervalSeconds());

        var response = jobManagementService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Job scheduled successfully"));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List jobs ordered by run time")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs(
            @Parameter(description = "Only jobs in this status (scheduled, running, done, cancelled, dead)")
            @RequestParam(required = false) String status) {

        var filter = status != null ? JobStatus.fromCode(status) : null;
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs(filter)));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a job by its unique identifier")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(jobId)));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel job", description = "Cancel a job that has not started running")
    public ResponseEntity<ApiResponse<JobResponse>> cancelJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Cancel job {}", jobId);

        var response = jobManagementService.cancelJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(response, "Job cancelled"));
    }

    // === Statistics ===

    @GetMapping("/statistics")
    @Operation(summary = "Get job statistics", description = "Job counts by status, queue depth and worker usage")
    public ResponseEntity<ApiResponse<JobStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getStatistics()));
    }

    // === Health Check ===

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the job scheduler is healthy")
    public ResponseEntity<ApiResponse<String>> healthCheck() {
        return ResponseEntity.ok(ApiResponse.success("OK", "Job scheduler is running"));
    }
}
