package com.example.tasksync.service.sync;

import com.example.tasksync.config.MetricsConfig;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.exception.CalendarAccessException;
import com.example.tasksync.exception.TokenRefreshException;
import com.example.tasksync.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Switches a user's calendar sync off after an unrecoverable credential or
 * calendar access failure and stores the notice shown on the next settings read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntegrationFailureHandler {

    public static final String AUTH_EXPIRED_NOTICE =
            "Google authorization expired. Please reconnect Google Calendar in Settings.";
    public static final String WRITE_ACCESS_LOST_NOTICE =
            "Calendar write access lost. Please re-enable sync in Settings.";
    public static final String CALENDAR_DELETED_NOTICE =
            "The sync calendar was deleted. Please re-enable sync in Settings.";

    private final CalendarSyncSettingsRepository settingsRepository;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * @return true if this call disabled the integration, false if it was already off
     */
    public boolean disableIntegration(long userId, RuntimeException cause) {
        var notice = noticeFor(cause);
        var updated = settingsRepository.disableWithError(userId, notice, clock.instant());
        if (updated == 0) {
            log.debug("Calendar sync for user {} already disabled", userId);
            return false;
        }

        log.error("Disabled calendar sync for user {}: {}", userId, cause.getMessage());
        metricsConfig.recordSyncFailure("integration_disabled");
        slackAlertService.sendIntegrationDisabledAlert(userId, notice, cause.getMessage());
        return true;
    }

    static String noticeFor(RuntimeException cause) {
        if (cause instanceof CalendarAccessException access) {
            return access.isCalendarDeleted() ? CALENDAR_DELETED_NOTICE : WRITE_ACCESS_LOST_NOTICE;
        }
        if (cause instanceof TokenRefreshException) {
            return AUTH_EXPIRED_NOTICE;
        }
        return WRITE_ACCESS_LOST_NOTICE;
    }
}
