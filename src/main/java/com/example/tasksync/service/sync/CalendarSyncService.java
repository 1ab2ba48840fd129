package com.example.tasksync.service.sync;

import com.example.tasksync.client.ClientModels.GoogleEvent;
import com.example.tasksync.client.GoogleCalendarClient;
import com.example.tasksync.config.MetricsConfig;
import com.example.tasksync.domain.UnitRef;
import com.example.tasksync.domain.entity.CalendarEventSync;
import com.example.tasksync.domain.entity.CalendarSyncSettings;
import com.example.tasksync.domain.enums.SyncOutcome;
import com.example.tasksync.domain.repository.CalendarEventSyncRepository;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.exception.CalendarAccessException;
import com.example.tasksync.exception.EventNotFoundException;
import com.example.tasksync.exception.TokenRefreshException;
import com.example.tasksync.service.calendar.CalendarApiGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Pushes single units to the user's calendar.
 * <p>
 * Protocol per unit, under the unit's lock:
 * - no sync record: create the event, then insert the record
 * - record with the same fingerprint: nothing to do
 * - record with another fingerprint: update the event (recreate it if it vanished remotely)
 * - unit gone or no longer syncable: delete the event and the record
 * <p>
 * If another replica inserted the record first, the unique constraint rejects
 * our insert; the event we just created is deleted and the existing record wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarSyncService {

    private final CalendarSyncSettingsRepository settingsRepository;
    private final CalendarEventSyncRepository syncRepository;
    private final SchedulableUnitResolver unitResolver;
    private final CalendarEventFactory eventFactory;
    private final GoogleCalendarClient calendarClient;
    private final CalendarApiGateway apiGateway;
    private final UnitLockRegistry unitLocks;
    private final IntegrationFailureHandler integrationFailureHandler;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Bring one unit's event in line with its current local state. Never throws:
     * failures are logged and left to the next reconciliation sweep.
     */
    public SyncOutcome syncUnit(long userId, UnitRef ref) {
        var settings = findActiveSettings(userId);
        if (settings.isEmpty()) {
            log.debug("Calendar sync disabled for user {}, skipping {}", userId, ref);
            return SyncOutcome.SKIPPED;
        }

        SyncOutcome outcome;
        try {
            outcome = unitLocks.withLock(ref, () -> unitResolver.resolve(userId, ref)
                    .map(unit -> push(settings.get(), unit))
                    .orElseGet(() -> remove(settings.get(), ref)));
        } catch (CalendarAccessException | TokenRefreshException e) {
            integrationFailureHandler.disableIntegration(userId, e);
            outcome = SyncOutcome.FAILED;
        } catch (Exception e) {
            log.warn("Sync of {} for user {} failed, leaving it to the next sweep: {}", ref, userId, e.getMessage());
            metricsConfig.recordSyncFailure(e.getClass().getSimpleName());
            outcome = SyncOutcome.FAILED;
        }

        log.debug("Synced {} for user {}: {}", ref, userId, outcome);
        metricsConfig.recordSyncOutcome(outcome);
        return outcome;
    }

    /**
     * Push a unit taken from a sweep snapshot. The unit is resolved again under
     * its lock, so an edit pushed since the snapshot is never overwritten with
     * stale data. Exceptions propagate to the caller.
     */
    public SyncOutcome pushUnit(CalendarSyncSettings settings, SchedulableUnit snapshot) {
        var ref = snapshot.getRef();
        var outcome = unitLocks.withLock(ref, () -> unitResolver.resolve(settings.getUserId(), ref)
                .map(current -> push(settings, current))
                .orElseGet(() -> remove(settings, ref)));
        metricsConfig.recordSyncOutcome(outcome);
        return outcome;
    }

    /**
     * Delete an orphaned record and its event, unless the unit turned out to be
     * live again by the time its lock is taken.
     */
    public SyncOutcome removeOrphan(CalendarSyncSettings settings, CalendarEventSync record) {
        var ref = record.getUnitRef();
        var outcome = unitLocks.withLock(ref, () -> {
            if (unitResolver.resolve(settings.getUserId(), ref).isPresent()) {
                log.info("Unit {} of user {} is live again, keeping its event", ref, settings.getUserId());
                return SyncOutcome.UNCHANGED;
            }
            deleteEventAndRecord(settings, record);
            return SyncOutcome.DELETED;
        });
        metricsConfig.recordSyncOutcome(outcome);
        return outcome;
    }

    /**
     * Delete events tagged with a unit whose sync record points at another event.
     * Such duplicates are left behind when a process dies between creating an
     * event and losing the race for its record. Untracked tags are left alone.
     *
     * @return number of events deleted
     */
    public int removeDuplicateEvents(CalendarSyncSettings settings, Instant from, Instant to) {
        var userId = settings.getUserId();
        var calendarId = settings.getCalendarId();
        var events = apiGateway.call(userId, "list events",
                token -> calendarClient.listEvents(token, calendarId, from, to));

        var removed = 0;
        for (var event : events) {
            var ref = unitOf(event);
            if (ref.isEmpty()) {
                continue;
            }
            var duplicate = unitLocks.withLock(ref.get(), () -> findRecord(ref.get())
                    .filter(record -> !record.getGoogleEventId().equals(event.getId()))
                    .isPresent());
            if (duplicate) {
                log.info("Deleting duplicate event {} of {} for user {}", event.getId(), ref.get(), userId);
                apiGateway.call(userId, "delete event",
                        token -> calendarClient.deleteEvent(token, calendarId, event.getId()));
                metricsConfig.recordSyncOutcome(SyncOutcome.DELETED);
                removed++;
            }
        }
        return removed;
    }

    private SyncOutcome push(CalendarSyncSettings settings, SchedulableUnit unit) {
        var hash = SyncFingerprint.of(unit);
        var existing = findRecord(unit.getRef());
        if (existing.isPresent()) {
            if (hash.equals(existing.get().getSyncHash())) {
                return SyncOutcome.UNCHANGED;
            }
            return update(settings, unit, existing.get(), hash);
        }
        return create(settings, unit, hash);
    }

    private SyncOutcome create(CalendarSyncSettings settings, SchedulableUnit unit, String hash) {
        var userId = settings.getUserId();
        var calendarId = settings.getCalendarId();
        var event = eventFactory.build(unit);
        var created = apiGateway.call(userId, "insert event",
                token -> calendarClient.insertEvent(token, calendarId, event));

        var record = CalendarEventSync.forUnit(unit.getRef())
                .userId(userId)
                .googleEventId(created.getId())
                .syncHash(hash)
                .lastSyncedAt(clock.instant())
                .build();
        try {
            syncRepository.saveAndFlush(record);
            log.debug("Created event {} for {}", created.getId(), unit.getRef());
            return SyncOutcome.CREATED;
        } catch (DataIntegrityViolationException e) {
            log.warn("Sync record for {} was created concurrently, discarding duplicate event {}", unit.getRef(), created.getId());
            apiGateway.call(userId, "delete event",
                    token -> calendarClient.deleteEvent(token, calendarId, created.getId()));
            var winner = findRecord(unit.getRef()).orElseThrow(() -> e);
            if (hash.equals(winner.getSyncHash())) {
                return SyncOutcome.UNCHANGED;
            }
            return update(settings, unit, winner, hash);
        }
    }

    private SyncOutcome update(CalendarSyncSettings settings, SchedulableUnit unit, CalendarEventSync record, String hash) {
        var userId = settings.getUserId();
        var calendarId = settings.getCalendarId();
        var event = eventFactory.build(unit);
        try {
            apiGateway.call(userId, "update event",
                    token -> calendarClient.updateEvent(token, calendarId, record.getGoogleEventId(), event));
        } catch (EventNotFoundException e) {
            log.info("Event {} for {} was deleted remotely, recreating it", record.getGoogleEventId(), unit.getRef());
            var recreated = apiGateway.call(userId, "insert event",
                    token -> calendarClient.insertEvent(token, calendarId, event));
            record.setGoogleEventId(recreated.getId());
        }
        record.setSyncHash(hash);
        record.setLastSyncedAt(clock.instant());
        syncRepository.save(record);
        return SyncOutcome.UPDATED;
    }

    private SyncOutcome remove(CalendarSyncSettings settings, UnitRef ref) {
        var record = findRecord(ref);
        if (record.isEmpty()) {
            return SyncOutcome.UNCHANGED;
        }
        deleteEventAndRecord(settings, record.get());
        return SyncOutcome.DELETED;
    }

    private void deleteEventAndRecord(CalendarSyncSettings settings, CalendarEventSync record) {
        apiGateway.call(settings.getUserId(), "delete event",
                token -> calendarClient.deleteEvent(token, settings.getCalendarId(), record.getGoogleEventId()));
        syncRepository.delete(record);
        log.debug("Deleted event {} of {}", record.getGoogleEventId(), record.getUnitRef());
    }

    private static Optional<UnitRef> unitOf(GoogleEvent event) {
        if (event.getExtendedProperties() == null || event.getExtendedProperties().getPrivateProperties() == null) {
            return Optional.empty();
        }
        return UnitRef.parse(event.getExtendedProperties().getPrivateProperties().get(CalendarEventFactory.UNIT_PROPERTY));
    }

    private Optional<CalendarEventSync> findRecord(UnitRef ref) {
        return switch (ref.getType()) {
            case TASK -> syncRepository.findByTaskId(ref.getId());
            case INSTANCE -> syncRepository.findByTaskInstanceId(ref.getId());
        };
    }

    private Optional<CalendarSyncSettings> findActiveSettings(long userId) {
        return settingsRepository.findByUserId(userId).filter(CalendarSyncSettings::isActive);
    }
}
