package com.example.jobscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle states of a scheduled job.
 * <p>
 * SCHEDULED -> RUNNING -> {DONE, SCHEDULED (retry or recurrence), DEAD};
 * SCHEDULED -> CANCELLED outside of execution.
 */
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Waiting in the time-ordered queue for its run time.
     * The only status that owns a pending queue entry.
     */
    SCHEDULED("scheduled"),

    /**
     * Claimed by the dispatcher and handed to a worker.
     */
    RUNNING("running"),

    /**
     * Completed successfully. Terminal unless the job is recurring.
     */
    DONE("done"),

    /**
     * Cancelled before it was dispatched. Terminal.
     */
    CANCELLED("cancelled"),

    /**
     * Retry budget exhausted. Terminal, kept for inspection and never re-dispatched.
     */
    DEAD("dead");

    private final String code;

    /**
     * Lowercase code used in the REST API, both in responses and in the status filter
     */
    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Find JobStatus by its code value
     */
    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }

    /**
     * Check if this status represents a terminal state
     */
    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == DEAD;
    }

    /**
     * Check if a job in this status is eligible to be picked up by the dispatcher
     */
    public boolean isDispatchable() {
        return this == SCHEDULED;
    }
}
