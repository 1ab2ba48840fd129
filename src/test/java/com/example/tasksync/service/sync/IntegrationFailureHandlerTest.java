package com.example.tasksync.service.sync;

import com.example.tasksync.config.MetricsConfig;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.exception.CalendarAccessException;
import com.example.tasksync.exception.TokenRefreshException;
import com.example.tasksync.service.alert.SlackAlertService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntegrationFailureHandler Tests")
class IntegrationFailureHandlerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private CalendarSyncSettingsRepository settingsRepository;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    private IntegrationFailureHandler handler;

    @BeforeEach
    void setUp() {
        handler = new IntegrationFailureHandler(settingsRepository, slackAlertService, metricsConfig,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should store the reconnect notice for a dead credential")
    void shouldStoreAuthNotice() {
        // Given
        when(settingsRepository.disableWithError(1L, IntegrationFailureHandler.AUTH_EXPIRED_NOTICE, NOW)).thenReturn(1);

        // When
        var disabled = handler.disableIntegration(1L, new TokenRefreshException(1L, "revoked"));

        // Then
        assertThat(disabled).isTrue();
        verify(slackAlertService).sendIntegrationDisabledAlert(eq(1L), eq(IntegrationFailureHandler.AUTH_EXPIRED_NOTICE), anyString());
        verify(metricsConfig).recordSyncFailure("integration_disabled");
    }

    @Test
    @DisplayName("Should alert only once when already disabled")
    void shouldNotAlertTwice() {
        // Given
        when(settingsRepository.disableWithError(anyLong(), anyString(), eq(NOW))).thenReturn(0);

        // When
        var disabled = handler.disableIntegration(1L, new CalendarAccessException("Google Calendar", 403, "forbidden"));

        // Then
        assertThat(disabled).isFalse();
        verifyNoInteractions(slackAlertService);
    }

    @Test
    @DisplayName("Should pick the notice from the failure")
    void shouldMapNotices() {
        assertThat(IntegrationFailureHandler.noticeFor(new CalendarAccessException("Google Calendar", 410, "gone")))
                .isEqualTo(IntegrationFailureHandler.CALENDAR_DELETED_NOTICE);
        assertThat(IntegrationFailureHandler.noticeFor(new CalendarAccessException("Google Calendar", 403, "forbidden")))
                .isEqualTo(IntegrationFailureHandler.WRITE_ACCESS_LOST_NOTICE);
        assertThat(IntegrationFailureHandler.noticeFor(new TokenRefreshException(1L, "x")))
                .isEqualTo(IntegrationFailureHandler.AUTH_EXPIRED_NOTICE);
    }
}
