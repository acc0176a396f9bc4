package com.example.jobscheduler.exception;

import com.example.jobscheduler.domain.enums.JobStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a state transition the job's current status does not allow
 */
@Getter
public class InvalidJobStateException extends RuntimeException {

    private final String jobId;
    private final JobStatus currentStatus;
    private final JobStatus requestedStatus;

    public InvalidJobStateException(UUID jobId, JobStatus currentStatus, JobStatus requestedStatus) {
        super(String.format("Cannot transition job %s from %s to %s", jobId, currentStatus, requestedStatus));
        this.jobId = jobId.toString();
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public InvalidJobStateException(UUID jobId, JobStatus currentStatus, JobStatus requestedStatus, String message) {
        super(String.format("Cannot transition job %s from %s to %s: %s", jobId, currentStatus, requestedStatus, message));
        this.jobId = jobId.toString();
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
