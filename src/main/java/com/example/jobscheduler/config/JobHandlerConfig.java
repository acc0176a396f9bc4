package com.example.jobscheduler.config;

import com.example.jobscheduler.client.WebhookClient;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.handler.LoggingJobHandler;
import com.example.jobscheduler.service.handler.WebhookJobHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the work callback invoked for dispatched jobs.
 * <p>
 * The webhook handler is used when {@code job-scheduler.webhook.enabled=true}; otherwise
 * the logging handler. An application-supplied {@link JobHandler} bean replaces both.
 */
@Slf4j
@Configuration
public class JobHandlerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "job-scheduler.webhook", name = "enabled", havingValue = "true")
    public WebhookClient webhookClient(@Qualifier("webhookWebClient") WebClient webClient, WebhookProperties properties) {
        if (properties.getUrl() == null || properties.getUrl().isBlank()) {
            throw new IllegalStateException("job-scheduler.webhook.url is required when the webhook handler is enabled");
        }
        return new WebhookClient(webClient, properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "job-scheduler.webhook", name = "enabled", havingValue = "true")
    public JobHandler webhookJobHandler(WebhookClient webhookClient) {
        log.info("Using webhook job handler");
        return new WebhookJobHandler(webhookClient);
    }

    @Bean
    @ConditionalOnMissingBean(JobHandler.class)
    public JobHandler loggingJobHandler(JobSchedulerProperties properties) {
        log.info("Using logging job handler (simulated work: {}ms)", properties.getSimulatedWorkMs());
        return new LoggingJobHandler(properties.getSimulatedWorkMs());
    }
}
