package com.example.jobscheduler.service.alert;

import com.example.jobscheduler.config.SlackProperties;
import com.example.jobscheduler.domain.model.ScheduledJob;
import com.example.jobscheduler.service.event.JobDeadLetteredEvent;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Sends an alert to Slack when a job is dead-lettered.
 * <p>
 * Sends formatted messages to the on-call channel with job details
 * to enable quick investigation.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:job-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Runs asynchronously so a slow Slack call never holds up a worker.
     */
    @Async
    @EventListener
    public void onJobDeadLettered(JobDeadLetteredEvent event) {
        var job = event.job();
        if (!slackProperties.isEnabled() || slackProperties.getWebhookUrl() == null || slackProperties.getWebhookUrl().isBlank()) {
            log.debug("Slack alerting is disabled. Job {} was dead-lettered but no alert was sent.", job.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildDeadLetterPayload(job, event.attempts()));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for dead-lettered job {}", job.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    Payload buildDeadLetterPayload(ScheduledJob job, int attempts) {
        var jobId = job.getId().toString();
        var lastError = job.getLastError() != null ? job.getLastError() : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Job Dead-Lettered - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title("Job " + jobId)
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/jobs/" + jobId)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Attempts")
                                                .value(String.valueOf(attempts))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Recurring")
                                                .value(String.valueOf(job.isRecurring()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Created At")
                                                .value(job.getCreatedAt() != null ? DATE_FORMATTER.format(job.getCreatedAt()) : "")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Payload")
                                                .value(truncate(job.getPayload(), 200))
                                                .valueShortEnough(false)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Please investigate and resubmit if needed")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
