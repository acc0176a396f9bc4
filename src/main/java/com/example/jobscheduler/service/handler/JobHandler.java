package com.example.jobscheduler.service.handler;

/**
 * Work callback invoked for every dispatched job.
 * <p>
 * Implementations should:
 * - Be stateless and thread-safe, several workers call them concurrently
 * - Treat the payload as opaque
 * - Respond to interruption, it is how an attempt that runs past its timeout is stopped
 * <p>
 * A thrown exception counts as a failed attempt, the same as a failure result.
 */
public interface JobHandler {

    /**
     * Execute one attempt of a job
     *
     * @param payload the job's payload, exactly as submitted
     * @return result of the attempt
     */
    JobExecutionResult execute(String payload) throws Exception;
}
