package com.example.jobscheduler.service.event;

import com.example.jobscheduler.domain.model.ScheduledJob;

/**
 * Published when a job exhausts its retries and moves to DEAD.
 *
 * @param job      the job as stored after the transition
 * @param attempts total attempts made, all failed
 */
public record JobDeadLetteredEvent(ScheduledJob job, int attempts) {
}
