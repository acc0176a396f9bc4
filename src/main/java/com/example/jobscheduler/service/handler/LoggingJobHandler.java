package com.example.jobscheduler.service.handler;

import lombok.extern.slf4j.Slf4j;

/**
 * Default handler: logs the payload and reports success after a simulated amount of work.
 */
@Slf4j
public class LoggingJobHandler implements JobHandler {

    private final long simulatedWorkMs;

    public LoggingJobHandler(long simulatedWorkMs) {
        this.simulatedWorkMs = simulatedWorkMs;
    }

    @Override
    public JobExecutionResult execute(String payload) throws InterruptedException {
        log.info("Executing job payload: {}", payload);
        if (simulatedWorkMs > 0) {
            Thread.sleep(simulatedWorkMs);
        }
        return JobExecutionResult.success();
    }
}
