package com.example.tasksync.service.alert;

import com.example.tasksync.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackAlertService Tests")
class SlackAlertServiceTest {

    @Mock
    private Slack slack;

    private SlackProperties properties;
    private SlackAlertService alertService;

    @BeforeEach
    void setUp() {
        properties = new SlackProperties();
        properties.setWebhookUrl("https://hooks.slack.test/services/T000/B000/XXX");
        alertService = new SlackAlertService(properties, slack);
    }

    @Test
    @DisplayName("Should post the disabled-integration alert to the webhook")
    void shouldSendIntegrationDisabledAlert() throws Exception {
        // Given
        when(slack.send(eq(properties.getWebhookUrl()), any(Payload.class)))
                .thenReturn(WebhookResponse.builder().code(200).build());

        // When
        alertService.sendIntegrationDisabledAlert(7L, "Reconnect your calendar", "invalid_grant");

        // Then
        var payload = ArgumentCaptor.forClass(Payload.class);
        verify(slack).send(eq(properties.getWebhookUrl()), payload.capture());
        assertThat(payload.getValue().getChannel()).isEqualTo("#calendar-sync-alerts");
        assertThat(payload.getValue().getAttachments().get(0).getTitleLink())
                .isEqualTo("http://localhost:8080/users/7/calendar-sync");
    }

    @Test
    @DisplayName("Should not call Slack when alerting is disabled")
    void shouldSkipWhenDisabled() {
        // Given
        properties.setEnabled(false);

        // When
        alertService.sendErrorAlert("Maintenance overran", "Budget exceeded", null);

        // Then
        verifyNoInteractions(slack);
    }
}
