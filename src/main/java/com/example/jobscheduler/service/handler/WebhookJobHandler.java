package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.client.WebhookClient;
import com.example.jobscheduler.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handler that POSTs each job's payload to a webhook endpoint.
 * <p>
 * Any non-2xx status or transport error fails the attempt.
 */
@Slf4j
@RequiredArgsConstructor
public class WebhookJobHandler implements JobHandler {

    private final WebhookClient webhookClient;

    @Override
    public JobExecutionResult execute(String payload) {
        try {
            var status = webhookClient.deliver(payload);
            log.debug("Webhook accepted payload with status {}", status);
            return JobExecutionResult.success();
        } catch (ExternalServiceException e) {
            if (e.getHttpStatusCode() != null) {
                return JobExecutionResult.httpFailure(e.getHttpStatusCode(), e.getMessage());
            }
            return JobExecutionResult.failure(e);
        }
    }
}
