package com.example.tasksync.service.sync;

import com.example.tasksync.config.MetricsConfig;
import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.entity.CalendarSyncSettings;
import com.example.tasksync.domain.enums.SyncOutcome;
import com.example.tasksync.domain.repository.CalendarEventSyncRepository;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.dto.SyncStats;
import com.example.tasksync.exception.CalendarAccessException;
import com.example.tasksync.exception.TokenRefreshException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Full per-user pass that heals whatever the fire-and-forget path missed.
 * <p>
 * Flow:
 * 1. Remember when the sweep started, then snapshot units and sync records
 * 2. Create or update an event for every unit (cancellation is checked between units)
 * 3. Remove duplicate events of tracked units found in the calendar
 * 4. Before deleting anything, add every unit created since the sweep started to the live set
 * 5. Delete records with no live unit, together with their events
 * <p>
 * A cancelled sweep never deletes. Only one sweep per user runs at a time in this process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final CalendarSyncSettingsRepository settingsRepository;
    private final CalendarEventSyncRepository syncRepository;
    private final SchedulableUnitResolver unitResolver;
    private final CalendarSyncService calendarSyncService;
    private final IntegrationFailureHandler integrationFailureHandler;
    private final MetricsConfig metricsConfig;
    private final TaskSyncProperties properties;
    private final Clock clock;

    private final Set<Long> runningSweeps = ConcurrentHashMap.newKeySet();

    public SyncStats reconcile(long userId) {
        return reconcile(userId, () -> false);
    }

    /**
     * @param cancelled polled between units; once true the sweep stops and skips orphan deletion
     */
    public SyncStats reconcile(long userId, BooleanSupplier cancelled) {
        if (!runningSweeps.add(userId)) {
            log.info("Sweep already running for user {}, skipping", userId);
            return SyncStats.withError("Sweep already in progress");
        }

        var timer = metricsConfig.startTimer();
        var stats = new SyncStats();
        try {
            var settings = settingsRepository.findByUserId(userId).filter(CalendarSyncSettings::isActive);
            if (settings.isEmpty()) {
                return SyncStats.withError("Calendar sync not enabled");
            }
            stats = sweep(settings.get(), cancelled);
            return stats;
        } finally {
            runningSweeps.remove(userId);
            metricsConfig.recordSweep(timer, stats.isCancelled());
        }
    }

    private SyncStats sweep(CalendarSyncSettings settings, BooleanSupplier cancelled) {
        var userId = settings.getUserId();
        var stats = new SyncStats();
        var sweepStartedAt = clock.instant();

        var units = unitResolver.snapshot(userId);
        var records = syncRepository.findByUserId(userId);
        log.info("Reconciling {} units and {} sync records for user {}", units.size(), records.size(), userId);

        var liveKeys = new HashSet<String>();
        for (var unit : units) {
            liveKeys.add(unit.getRef().key());
        }

        for (var unit : units) {
            if (cancelled.getAsBoolean()) {
                stats.setCancelled(true);
                break;
            }
            try {
                stats.record(calendarSyncService.pushUnit(settings, unit));
            } catch (CalendarAccessException | TokenRefreshException e) {
                integrationFailureHandler.disableIntegration(userId, e);
                stats.setError(e.getMessage());
                return stats;
            } catch (Exception e) {
                log.warn("Sweep failed to push {} for user {}: {}", unit.getRef(), userId, e.getMessage());
                metricsConfig.recordSyncFailure(e.getClass().getSimpleName());
                stats.record(SyncOutcome.FAILED);
            }
        }

        if (stats.isCancelled()) {
            log.warn("Sweep for user {} cancelled after {} created, {} updated; orphan cleanup skipped",
                    userId, stats.getCreated(), stats.getUpdated());
            return stats;
        }

        try {
            var today = LocalDate.ofInstant(sweepStartedAt, ZoneOffset.UTC);
            stats.setDeleted(stats.getDeleted() + calendarSyncService.removeDuplicateEvents(settings,
                    today.minusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                    today.plusDays(properties.getRecurrence().getHorizonDays() + 1L).atStartOfDay(ZoneOffset.UTC).toInstant()));
        } catch (CalendarAccessException | TokenRefreshException e) {
            integrationFailureHandler.disableIntegration(userId, e);
            stats.setError(e.getMessage());
            return stats;
        } catch (Exception e) {
            log.warn("Duplicate event check for user {} failed: {}", userId, e.getMessage());
        }

        unitResolver.createdSince(userId, sweepStartedAt).forEach(ref -> liveKeys.add(ref.key()));

        for (var record : records) {
            if (liveKeys.contains(record.getUnitRef().key())) {
                continue;
            }
            if (cancelled.getAsBoolean()) {
                stats.setCancelled(true);
                break;
            }
            try {
                stats.record(calendarSyncService.removeOrphan(settings, record));
            } catch (CalendarAccessException | TokenRefreshException e) {
                integrationFailureHandler.disableIntegration(userId, e);
                stats.setError(e.getMessage());
                return stats;
            } catch (Exception e) {
                log.warn("Sweep failed to remove orphan {} for user {}: {}", record.getUnitRef(), userId, e.getMessage());
                stats.record(SyncOutcome.FAILED);
            }
        }

        if (stats.isSuccessful()) {
            settingsRepository.markSweepSucceeded(userId, clock.instant());
        }
        log.info("Sweep for user {} done: created={}, updated={}, skipped={}, deleted={}, failed={}",
                userId, stats.getCreated(), stats.getUpdated(), stats.getSkipped(), stats.getDeleted(), stats.getFailed());
        return stats;
    }
}
