package com.example.tasksync.service.sync;

import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.UnitRef;
import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.domain.enums.InstanceStatus;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.TaskInstanceRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decides which local units belong in the calendar and snapshots them.
 * <p>
 * A one-off task is synced when it is not archived and has a date (its
 * scheduled date, or its completion date once completed). An instance is
 * synced when its parent exists, is not archived and has a time.
 */
@Component
@RequiredArgsConstructor
public class SchedulableUnitResolver {

    private final TaskRepository taskRepository;
    private final TaskInstanceRepository instanceRepository;
    private final TaskSyncProperties properties;

    /**
     * Current state of one unit, or empty if it no longer belongs in the calendar
     */
    public Optional<SchedulableUnit> resolve(long userId, UnitRef ref) {
        return switch (ref.getType()) {
            case TASK -> taskRepository.findByIdAndUserId(ref.getId(), userId)
                    .flatMap(this::fromTask);
            case INSTANCE -> instanceRepository.findByIdAndUserId(ref.getId(), userId)
                    .flatMap(instance -> taskRepository.findById(instance.getTaskId())
                            .flatMap(parent -> fromInstance(instance, parent)));
        };
    }

    /**
     * Every unit of the user that should currently have a calendar event
     */
    public List<SchedulableUnit> snapshot(long userId) {
        var units = new ArrayList<SchedulableUnit>();
        for (var task : taskRepository.findSyncableOneOffTasks(userId, TaskStatus.ARCHIVED)) {
            fromTask(task).ifPresent(units::add);
        }

        var instances = instanceRepository.findSyncableInstances(userId, TaskStatus.ARCHIVED);
        var parentIds = instances.stream().map(TaskInstance::getTaskId).collect(Collectors.toSet());
        var parents = taskRepository.findAllById(parentIds).stream()
                .collect(Collectors.toMap(Task::getId, Function.identity()));
        for (var instance : instances) {
            var parent = parents.get(instance.getTaskId());
            if (parent != null) {
                fromInstance(instance, parent).ifPresent(units::add);
            }
        }
        return units;
    }

    /**
     * References of every task and instance created at or after the given instant,
     * syncable or not
     */
    public Set<UnitRef> createdSince(long userId, Instant since) {
        var refs = new HashSet<UnitRef>();
        taskRepository.findOneOffTaskIdsCreatedSince(userId, since).forEach(id -> refs.add(UnitRef.task(id)));
        instanceRepository.findIdsCreatedSince(userId, since).forEach(id -> refs.add(UnitRef.instance(id)));
        return refs;
    }

    Optional<SchedulableUnit> fromTask(Task task) {
        if (task.isRecurring() || task.isArchived()) {
            return Optional.empty();
        }
        var date = task.getEffectiveDate(properties.getRecurrence().getReferenceZone());
        if (date == null) {
            return Optional.empty();
        }
        var completed = task.getStatus() == TaskStatus.COMPLETED;
        return Optional.of(SchedulableUnit.builder()
                .ref(UnitRef.task(task.getId()))
                .userId(task.getUserId())
                .title(task.getTitle())
                .description(task.getDescription())
                .date(date)
                .time(task.getScheduledTime())
                .durationMinutes(task.getDurationMinutes())
                .impact(task.getImpact())
                .status(task.getStatus().getCode())
                .completed(completed)
                .build());
    }

    Optional<SchedulableUnit> fromInstance(TaskInstance instance, Task parent) {
        if (parent.isArchived() || parent.getOccurrenceTime() == null) {
            return Optional.empty();
        }
        var date = instance.getOccurrenceDate();
        var time = parent.getOccurrenceTime();
        if (instance.getScheduledDatetime() != null) {
            var local = LocalDateTime.ofInstant(instance.getScheduledDatetime(), properties.getRecurrence().getReferenceZone());
            date = local.toLocalDate();
            time = local.toLocalTime();
        }
        return Optional.of(SchedulableUnit.builder()
                .ref(UnitRef.instance(instance.getId()))
                .userId(instance.getUserId())
                .title(parent.getTitle())
                .description(parent.getDescription())
                .date(date)
                .time(time)
                .durationMinutes(parent.getDurationMinutes())
                .impact(parent.getImpact())
                .status(instance.getStatus().getCode())
                .completed(instance.getStatus() == InstanceStatus.COMPLETED)
                .build());
    }
}
