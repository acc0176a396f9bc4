package com.example.jobscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Target of the webhook job handler
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "job-scheduler.webhook")
public class WebhookProperties {
    private boolean enabled = false;
    private String url;
    private String contentType = "application/json";
    private int timeoutSeconds = 10;
}
