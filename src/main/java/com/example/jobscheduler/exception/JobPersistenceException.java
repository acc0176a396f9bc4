package com.example.jobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a failed write to, or read from, the durable job store.
 * <p>
 * Raised after the in-memory change has been applied (except on create), so callers
 * know the change is live but not yet durable.
 */
@Getter
public class JobPersistenceException extends RuntimeException {

    private final String jobId;

    public JobPersistenceException(UUID jobId, Throwable cause) {
        super(String.format("Failed to persist job %s: %s", jobId, cause.getMessage()), cause);
        this.jobId = jobId.toString();
    }

    public JobPersistenceException(String message, Throwable cause) {
        super(message, cause);
        this.jobId = null;
    }
}
