package com.example.tasksync.service.sync;

import com.example.tasksync.client.ClientModels.CalendarEntry;
import com.example.tasksync.client.GoogleCalendarClient;
import com.example.tasksync.config.CalendarSyncProperties;
import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.entity.CalendarSyncSettings;
import com.example.tasksync.domain.repository.CalendarEventSyncRepository;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.dto.SyncStatusResponse;
import com.example.tasksync.service.calendar.CalendarApiGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Turns a user's calendar sync on and off and reports its state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncSettingsService {

    private final CalendarSyncSettingsRepository settingsRepository;
    private final CalendarEventSyncRepository syncRepository;
    private final GoogleCalendarClient calendarClient;
    private final CalendarApiGateway apiGateway;
    private final IntegrationFailureHandler integrationFailureHandler;
    private final SyncTriggerService syncTriggerService;
    private final CalendarSyncProperties calendarSyncProperties;
    private final TaskSyncProperties taskSyncProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public SyncStatusResponse getStatus(long userId) {
        var settings = settingsRepository.findByUserId(userId);
        return SyncStatusResponse.builder()
                .enabled(settings.map(CalendarSyncSettings::isSyncEnabled).orElse(false))
                .calendarId(settings.map(CalendarSyncSettings::getCalendarId).orElse(null))
                .syncedCount(syncRepository.countByUserId(userId))
                .syncError(settings.map(CalendarSyncSettings::getSyncError).orElse(null))
                .syncErrorAt(settings.map(CalendarSyncSettings::getSyncErrorAt).orElse(null))
                .lastSweepAt(settings.map(CalendarSyncSettings::getLastSweepAt).orElse(null))
                .build();
    }

    /**
     * Find or create the dedicated calendar, switch sync on and queue a full sweep.
     * Calendar API failures propagate so the caller can report them.
     */
    @Transactional
    public SyncStatusResponse enableSync(long userId) {
        var calendar = findOrCreateCalendar(userId);

        var settings = settingsRepository.findByUserId(userId)
                .orElseGet(() -> CalendarSyncSettings.builder().userId(userId).build());
        settings.setSyncEnabled(true);
        settings.setCalendarId(calendar.getId());
        settings.setSyncError(null);
        settings.setSyncErrorAt(null);
        settingsRepository.save(settings);

        log.info("Enabled calendar sync for user {} on calendar {}", userId, calendar.getId());
        syncTriggerService.sweepRequested(userId);
        return getStatus(userId);
    }

    /**
     * Switch sync off. Sync records are always cleared; remote events are deleted
     * only when asked, one by one, and a failed delete does not stop the rest.
     */
    @Transactional
    public SyncStatusResponse disableSync(long userId, boolean deleteEvents) {
        var settings = settingsRepository.findByUserId(userId);
        if (deleteEvents && settings.filter(CalendarSyncSettings::isActive).isPresent()) {
            deleteMirroredEvents(userId, settings.get().getCalendarId());
        }

        var removed = syncRepository.deleteAllForUser(userId);
        settings.ifPresent(s -> {
            s.setSyncEnabled(false);
            settingsRepository.save(s);
        });

        log.info("Disabled calendar sync for user {}, cleared {} sync records", userId, removed);
        return getStatus(userId);
    }

    /**
     * Automatic disable after an unrecoverable calendar or credential failure.
     */
    public boolean disableWithError(long userId, RuntimeException cause) {
        return integrationFailureHandler.disableIntegration(userId, cause);
    }

    private CalendarEntry findOrCreateCalendar(long userId) {
        var name = calendarSyncProperties.getCalendarName();
        var calendars = apiGateway.call(userId, "list calendars", calendarClient::listCalendars);
        for (var calendar : calendars) {
            if (name.equals(calendar.getSummary())) {
                log.debug("Reusing calendar {} for user {}", calendar.getId(), userId);
                return calendar;
            }
        }

        var timeZone = taskSyncProperties.getRecurrence().getReferenceTimezone();
        var created = apiGateway.call(userId, "create calendar",
                token -> calendarClient.createCalendar(token, name, timeZone));
        log.info("Created calendar {} ({}) for user {}", name, created.getId(), userId);
        return created;
    }

    private void deleteMirroredEvents(long userId, String calendarId) {
        var deleted = 0;
        for (var record : syncRepository.findByUserId(userId)) {
            try {
                apiGateway.call(userId, "delete event",
                        token -> calendarClient.deleteEvent(token, calendarId, record.getGoogleEventId()));
                deleted++;
            } catch (Exception e) {
                log.warn("Failed to delete event {} of user {}: {}", record.getGoogleEventId(), userId, e.getMessage());
            }
        }
        log.info("Deleted {} mirrored events for user {}", deleted, userId);
    }
}
