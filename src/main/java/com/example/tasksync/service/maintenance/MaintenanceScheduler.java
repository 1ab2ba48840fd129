package com.example.tasksync.service.maintenance;

import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.entity.CalendarSyncSettings;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import com.example.tasksync.service.alert.SlackAlertService;
import com.example.tasksync.service.recurrence.RecurrenceService;
import com.example.tasksync.service.sync.ReconciliationService;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background loop that keeps recurring tasks materialized and calendars reconciled.
 * <p>
 * ShedLock ensures only one replica runs a cycle at a time.
 * <p>
 * Flow:
 * 1. Collect users owning recurring tasks or having calendar sync enabled
 * 2. Process users one after another, each in its own transaction scope
 * 3. Per user: top up instances over the horizon, then run a reconciliation sweep
 * 4. A user exceeding its time budget is cancelled at the next unit boundary
 * 5. Once the cycle budget is spent, remaining users wait for the next cycle
 */
@Slf4j
@Service
public class MaintenanceScheduler {

    private final TaskRepository taskRepository;
    private final CalendarSyncSettingsRepository settingsRepository;
    private final RecurrenceService recurrenceService;
    private final ReconciliationService reconciliationService;
    private final SlackAlertService slackAlertService;
    private final TaskSyncProperties properties;
    private final ExecutorService maintenanceExecutor;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public MaintenanceScheduler(TaskRepository taskRepository, CalendarSyncSettingsRepository settingsRepository,
                                RecurrenceService recurrenceService, ReconciliationService reconciliationService,
                                SlackAlertService slackAlertService, TaskSyncProperties properties,
                                @Qualifier("maintenanceExecutor") ExecutorService maintenanceExecutor,
                                Clock clock) {
        this.taskRepository = taskRepository;
        this.settingsRepository = settingsRepository;
        this.recurrenceService = recurrenceService;
        this.reconciliationService = reconciliationService;
        this.slackAlertService = slackAlertService;
        this.properties = properties;
        this.maintenanceExecutor = maintenanceExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${task-sync.maintenance.interval:PT1H}",
            initialDelayString = "${task-sync.maintenance.initial-delay:PT1M}")
    @SchedulerLock(name = "taskSyncMaintenance", lockAtLeastFor = "1m", lockAtMostFor = "55m")
    public void runMaintenanceCycle() {
        var maintenance = properties.getMaintenance();
        if (!maintenance.isEnabled()) {
            log.debug("Maintenance disabled, skipping cycle");
            return;
        }
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous maintenance cycle still running, skipping");
            return;
        }

        try {
            var deadline = clock.instant().plus(maintenance.getCycleTimeout());
            var userIds = new TreeSet<Long>(taskRepository.findUserIdsWithRecurringStatus(TaskStatus.PENDING));
            userIds.addAll(settingsRepository.findUserIdsWithSyncEnabled());
            log.info("Starting maintenance cycle for {} users", userIds.size());

            var processed = 0;
            var succeeded = 0;
            for (var userId : userIds) {
                if (clock.instant().isAfter(deadline)) {
                    log.warn("Maintenance cycle budget of {} spent after {} of {} users, resuming next cycle",
                            maintenance.getCycleTimeout(), processed, userIds.size());
                    slackAlertService.sendErrorAlert("Maintenance cycle over budget",
                            String.format("Processed %d of %d users within %s", processed, userIds.size(),
                                    maintenance.getCycleTimeout()),
                            null);
                    break;
                }
                if (processUser(userId)) {
                    succeeded++;
                }
                processed++;
            }
            log.info("Maintenance cycle done: {} users processed, {} successful", processed, succeeded);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Maintenance cycle interrupted");
        } catch (Exception e) {
            log.error("Error in maintenance cycle: {}", e.getMessage(), e);
            slackAlertService.sendErrorAlert("Maintenance cycle failed", e.getMessage(), e.getClass().getName());
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Delete resolved instances past the retention window.
     */
    @Scheduled(cron = "${task-sync.maintenance.retention-cron:0 30 3 * * *}")
    @SchedulerLock(name = "taskSyncRetention", lockAtLeastFor = "1m", lockAtMostFor = "30m")
    public void retireStaleInstances() {
        try {
            var retired = recurrenceService.retireStaleInstances(properties.getRecurrence().getRetentionDays());
            log.info("Retention job removed {} instances", retired);
        } catch (Exception e) {
            log.error("Error in retention job: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one user's maintenance on the maintenance executor within the user budget.
     *
     * @return true if the user's work finished in time without error
     */
    boolean processUser(long userId) throws InterruptedException {
        var cancelled = new AtomicBoolean(false);
        var future = CompletableFuture.supplyAsync(() -> maintainUser(userId, cancelled), maintenanceExecutor);
        var timeout = properties.getMaintenance().getUserTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelled.set(true);
            log.warn("Maintenance for user {} exceeded {}, cancelling; committed work stands", userId, timeout);
            return false;
        } catch (ExecutionException e) {
            log.error("Maintenance for user {} failed: {}", userId, e.getCause().getMessage(), e.getCause());
            return false;
        }
    }

    private boolean maintainUser(long userId, AtomicBoolean cancelled) {
        var created = recurrenceService.ensureMaterialized(userId);
        if (!created.isEmpty()) {
            log.debug("Topped up {} instances for user {}", created.size(), userId);
        }
        if (cancelled.get()) {
            return false;
        }

        var syncActive = settingsRepository.findByUserId(userId)
                .map(CalendarSyncSettings::isActive)
                .orElse(false);
        if (!syncActive) {
            return true;
        }
        var stats = reconciliationService.reconcile(userId, cancelled::get);
        return stats.isSuccessful();
    }
}
