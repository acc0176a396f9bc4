package com.example.jobscheduler.service.store;

/**
 * Result of a cancellation request against the job store
 */
public enum CancelOutcome {

    CANCELLED,

    NOT_FOUND,

    /**
     * The job has been dispatched; running handlers are not preemptible
     */
    ALREADY_RUNNING,

    /**
     * The job is done, dead or already cancelled
     */
    ALREADY_TERMINAL
}
