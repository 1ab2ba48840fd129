package com.example.tasksync.service.alert;

import com.example.tasksync.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending operator alerts to Slack.
 * <p>
 * Alerts when a user's calendar integration is switched off automatically and
 * when the maintenance loop runs out of its time budget.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:task-calendar-sync}")
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
     * Send alert for an integration disabled after an unrecoverable credential or access error.
     * Runs asynchronously to not block sync processing.
     */
    @Async
    public void sendIntegrationDisabledAlert(long userId, String notice, String cause) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Calendar sync for user {} was disabled but no alert was sent.", userId);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":calendar:")
                    .text(":warning: *Calendar sync disabled for a user*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .title("User " + userId)
                                    .titleLink(buildUserLink(userId))
                                    .fields(Arrays.asList(
                                            Field.builder()
                                                    .title("Notice shown to user")
                                                    .value(notice)
                                                    .valueShortEnough(false)
                                                    .build(),
                                            Field.builder()
                                                    .title("Cause")
                                                    .value("```" + truncate(cause, 400) + "```")
                                                    .valueShortEnough(false)
                                                    .build()
                                    ))
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for disabled calendar sync of user {}", userId);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for user {}: {}", userId, e.getMessage(), e);
        }
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(
                                            Field.builder()
                                                    .title("Details")
                                                    .value(truncate(details, 500))
                                                    .valueShortEnough(false)
                                                    .build()
                                    ) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private String buildUserLink(long userId) {
        return slackProperties.getDashboardBaseUrl() + "/users/" + userId + "/calendar-sync";
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
