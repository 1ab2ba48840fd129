package com.example.tasksync.service.recurrence;

import com.example.tasksync.config.MetricsConfig;
import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.domain.enums.InstanceStatus;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.TaskInstanceInsertDao;
import com.example.tasksync.domain.repository.TaskInstanceRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

/**
 * Keeps recurring tasks materialized as concrete instances over a rolling horizon.
 * <p>
 * Materialization is idempotent: dates already stored are skipped and a concurrent
 * insert of the same date only rolls back its own savepoint. Archiving a task does
 * not touch its instances here; read paths filter them by parent status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecurrenceService {

    private final TaskRepository taskRepository;
    private final TaskInstanceRepository instanceRepository;
    private final TaskInstanceInsertDao instanceInsertDao;
    private final RecurrenceEngine recurrenceEngine;
    private final TaskSyncProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Materialize instances over the configured horizon.
     */
    @Transactional
    public List<TaskInstance> materialize(Task task) {
        return materialize(task, properties.getRecurrence().getHorizonDays());
    }

    /**
     * Insert an instance for every occurrence date in the horizon not stored yet.
     *
     * @return the instances inserted by this call
     */
    @Transactional
    public List<TaskInstance> materialize(Task task, int horizonDays) {
        if (!task.isActiveRecurrence()) {
            return List.of();
        }

        var today = today();
        var dates = recurrenceEngine.occurrences(task, ruleStart(task, today), today, horizonDays);
        if (dates.isEmpty()) {
            return List.of();
        }

        var existing = new HashSet<>(instanceRepository.findOccurrenceDates(
                task.getId(), dates.get(0), dates.get(dates.size() - 1)));
        var time = task.getOccurrenceTime();
        var zone = properties.getRecurrence().getReferenceZone();

        var created = new ArrayList<TaskInstance>();
        for (var date : dates) {
            if (existing.contains(date)) {
                continue;
            }
            var instance = TaskInstance.builder()
                    .id(UUID.randomUUID())
                    .taskId(task.getId())
                    .userId(task.getUserId())
                    .occurrenceDate(date)
                    .scheduledDatetime(time != null ? LocalDateTime.of(date, time).atZone(zone).toInstant() : null)
                    .status(InstanceStatus.PENDING)
                    .build();
            if (instanceInsertDao.insertIfAbsent(instance)) {
                created.add(instance);
            }
        }

        if (!created.isEmpty()) {
            log.info("Materialized {} instances for task {}", created.size(), task.getId());
            metricsConfig.recordMaterialized(created.size());
        }
        return created;
    }

    /**
     * Top up every recurring task of a user whose latest instance is close to the
     * horizon end. Runs in one transaction for the whole user.
     */
    @Transactional
    public List<TaskInstance> ensureMaterialized(long userId) {
        var recurrence = properties.getRecurrence();
        var threshold = today().plusDays(recurrence.getHorizonDays() - recurrence.getRefreshThresholdDays());

        var created = new ArrayList<TaskInstance>();
        for (var task : taskRepository.findByUserIdAndRecurringTrueAndStatus(userId, TaskStatus.PENDING)) {
            var latest = instanceRepository.findLatestOccurrenceDate(task.getId());
            if (latest.isPresent() && !latest.get().isBefore(threshold)) {
                continue;
            }
            created.addAll(materialize(task, recurrence.getHorizonDays()));
        }
        return created;
    }

    /**
     * Drop future pending instances and expand the current rule again. Past and
     * resolved instances are kept.
     */
    @Transactional
    public Regeneration regenerate(Task task) {
        var removed = instanceRepository.findIdsByTaskIdAndStatusFrom(task.getId(), InstanceStatus.PENDING, today());
        if (!removed.isEmpty()) {
            instanceRepository.deleteByIds(removed);
            log.info("Removed {} future pending instances of task {}", removed.size(), task.getId());
        }
        return new Regeneration(removed, materialize(task));
    }

    /**
     * Delete completed and skipped instances older than the retention window.
     * Pending instances are kept however old they are.
     */
    @Transactional
    public int retireStaleInstances(int retentionDays) {
        var cutoff = today().minusDays(retentionDays);
        var retired = instanceRepository.deleteResolvedBefore(cutoff, InstanceStatus.retirable());
        if (retired > 0) {
            log.info("Retired {} resolved instances older than {}", retired, cutoff);
            metricsConfig.recordRetired(retired);
        }
        return retired;
    }

    private LocalDate ruleStart(Task task, LocalDate today) {
        if (task.getRecurrenceStart() != null) {
            return task.getRecurrenceStart();
        }
        if (task.getCreatedAt() != null) {
            return LocalDate.ofInstant(task.getCreatedAt(), properties.getRecurrence().getReferenceZone());
        }
        return today;
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), properties.getRecurrence().getReferenceZone());
    }
}
