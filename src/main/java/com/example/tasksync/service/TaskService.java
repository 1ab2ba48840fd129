package com.example.tasksync.service;

import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.UnitRef;
import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.domain.enums.InstanceStatus;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.TaskInstanceRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import com.example.tasksync.dto.CreateTaskRequest;
import com.example.tasksync.dto.TaskInstanceResponse;
import com.example.tasksync.dto.TaskResponse;
import com.example.tasksync.dto.UpdateTaskRequest;
import com.example.tasksync.exception.InvalidRecurrenceRuleException;
import com.example.tasksync.exception.InvalidTaskStateException;
import com.example.tasksync.exception.TaskNotFoundException;
import com.example.tasksync.mapper.TaskMapper;
import com.example.tasksync.service.recurrence.RecurrenceRuleValidator;
import com.example.tasksync.service.recurrence.RecurrenceService;
import com.example.tasksync.service.sync.SyncTriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for task and instance lifecycle operations.
 * <p>
 * Provides:
 * - Task creation, with immediate materialization of recurring tasks
 * - Updates, rebuilding future instances when the rule or timing changes
 * - Archival and deletion
 * - Instance actions (complete, skip, reschedule, reopen)
 * <p>
 * Every mutation queues a calendar sync for the units it touched; the sync runs
 * after the transaction commits and is never awaited here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    private final TaskRepository taskRepository;
    private final TaskInstanceRepository instanceRepository;
    private final RecurrenceService recurrenceService;
    private final RecurrenceRuleValidator ruleValidator;
    private final SyncTriggerService syncTriggerService;
    private final TaskMapper taskMapper;
    private final TaskSyncProperties properties;
    private final Clock clock;

    // === Tasks ===

    @Transactional
    public TaskResponse createTask(long userId, CreateTaskRequest request) {
        log.info("Creating {} task for user {}", request.isRecurring() ? "recurring" : "one-off", userId);

        var task = Task.builder()
                .userId(userId)
                .title(request.getTitle())
                .description(request.getDescription())
                .durationMinutes(request.getDurationMinutes())
                .impact(request.getImpact() != null ? request.getImpact() : Task.DEFAULT_IMPACT)
                .scheduledDate(request.getScheduledDate())
                .scheduledTime(request.getScheduledTime())
                .status(TaskStatus.PENDING)
                .createdAt(now())
                .build();

        if (request.isRecurring()) {
            if (request.getRecurrenceRule() == null) {
                throw new InvalidRecurrenceRuleException("recurring task needs a rule");
            }
            var rule = taskMapper.toRule(request.getRecurrenceRule());
            var start = request.getRecurrenceStart() != null ? request.getRecurrenceStart() : today();
            ruleValidator.validate(rule, start, request.getRecurrenceEnd());
            task.setRecurring(true);
            task.setRecurrenceRule(rule);
            task.setRecurrenceStart(start);
            task.setRecurrenceEnd(request.getRecurrenceEnd());
        }

        // Instances are inserted over plain JDBC, so the task row must exist first
        task = taskRepository.saveAndFlush(task);
        log.info("Created task {} for user {}", task.getId(), userId);

        if (task.isRecurring()) {
            var created = recurrenceService.materialize(task);
            syncTriggerService.unitsChanged(userId, instanceRefs(created));
        } else {
            syncTriggerService.unitChanged(userId, UnitRef.task(task.getId()));
        }
        return taskMapper.toResponse(task);
    }

    /**
     * Apply a partial update. For recurring tasks a new rule, start, end or time
     * rebuilds future pending instances; every remaining instance is re-synced
     * since its event shows the parent's title and details.
     */
    @Transactional
    public TaskResponse updateTask(long userId, UUID taskId, UpdateTaskRequest request) {
        var task = findTask(userId, taskId);
        log.info("Updating task {} for user {}", taskId, userId);

        var timingChanged = false;
        if (request.getTitle() != null) {
            task.setTitle(request.getTitle());
        }
        if (request.getDescription() != null) {
            task.setDescription(request.getDescription());
        }
        if (request.getDurationMinutes() != null) {
            task.setDurationMinutes(request.getDurationMinutes());
        }
        if (request.getImpact() != null) {
            task.setImpact(request.getImpact());
        }
        if (request.getScheduledDate() != null) {
            task.setScheduledDate(request.getScheduledDate());
        }
        if (request.getScheduledTime() != null && !request.getScheduledTime().equals(task.getScheduledTime())) {
            task.setScheduledTime(request.getScheduledTime());
            timingChanged = true;
        }

        if (request.getRecurrenceRule() != null || request.getRecurrenceStart() != null || request.getRecurrenceEnd() != null) {
            if (!task.isRecurring()) {
                throw new InvalidRecurrenceRuleException("task " + taskId + " is not recurring");
            }
            var rule = request.getRecurrenceRule() != null
                    ? taskMapper.toRule(request.getRecurrenceRule())
                    : task.getRecurrenceRule();
            var start = request.getRecurrenceStart() != null ? request.getRecurrenceStart() : task.getRecurrenceStart();
            var end = request.getRecurrenceEnd() != null ? request.getRecurrenceEnd() : task.getRecurrenceEnd();
            ruleValidator.validate(rule, start, end);
            task.setRecurrenceRule(rule);
            task.setRecurrenceStart(start);
            task.setRecurrenceEnd(end);
            timingChanged = true;
        }

        var unarchived = false;
        if (request.getStatus() != null && request.getStatus() != task.getStatus()) {
            unarchived = applyStatusChange(task, request.getStatus());
        }

        task = taskRepository.save(task);

        if (!task.isRecurring()) {
            syncTriggerService.unitChanged(userId, UnitRef.task(taskId));
            return taskMapper.toResponse(task);
        }

        var refs = new LinkedHashSet<UnitRef>();
        if (timingChanged && !task.isArchived()) {
            var regeneration = recurrenceService.regenerate(task);
            regeneration.getRemovedInstanceIds().forEach(id -> refs.add(UnitRef.instance(id)));
        } else if (unarchived) {
            recurrenceService.materialize(task);
        }
        instanceRepository.findIdsByTaskId(taskId).forEach(id -> refs.add(UnitRef.instance(id)));
        syncTriggerService.unitsChanged(userId, refs);
        return taskMapper.toResponse(task);
    }

    /**
     * Delete a task. A recurring task takes all its instances with it, and each
     * instance's calendar event is removed by the queued sync.
     */
    @Transactional
    public void deleteTask(long userId, UUID taskId) {
        var task = findTask(userId, taskId);

        if (task.isRecurring()) {
            var instanceIds = instanceRepository.findIdsByTaskId(taskId);
            instanceRepository.deleteByTaskId(taskId);
            taskRepository.delete(task);
            log.info("Deleted recurring task {} with {} instances", taskId, instanceIds.size());
            syncTriggerService.unitsChanged(userId, instanceIds.stream().map(UnitRef::instance).toList());
        } else {
            taskRepository.delete(task);
            log.info("Deleted task {}", taskId);
            syncTriggerService.unitChanged(userId, UnitRef.task(taskId));
        }
    }

    /**
     * Complete a one-off task. Recurring tasks are completed per instance.
     */
    @Transactional
    public TaskResponse completeTask(long userId, UUID taskId) {
        var task = findTask(userId, taskId);
        if (task.isRecurring()) {
            throw new InvalidTaskStateException(taskId, "recurring", TaskStatus.COMPLETED.getCode());
        }
        if (task.getStatus() != TaskStatus.PENDING) {
            throw new InvalidTaskStateException(taskId, task.getStatus().getCode(), TaskStatus.COMPLETED.getCode());
        }

        task.setStatus(TaskStatus.COMPLETED);
        task.setCompletedAt(now());
        task = taskRepository.save(task);
        log.info("Completed task {}", taskId);

        syncTriggerService.unitChanged(userId, UnitRef.task(taskId));
        return taskMapper.toResponse(task);
    }

    @Transactional(readOnly = true)
    public Optional<TaskResponse> getTask(long userId, UUID taskId) {
        return taskRepository.findByIdAndUserId(taskId, userId).map(taskMapper::toResponse);
    }

    // === Instances ===

    @Transactional
    public TaskInstanceResponse completeInstance(long userId, UUID instanceId) {
        var instance = findInstance(userId, instanceId);
        if (instance.getStatus() == InstanceStatus.COMPLETED) {
            return taskMapper.toInstanceResponse(instance);
        }
        instance.complete(now());
        return saveAndTrigger(userId, instance);
    }

    @Transactional
    public TaskInstanceResponse skipInstance(long userId, UUID instanceId) {
        var instance = findInstance(userId, instanceId);
        if (instance.getStatus() == InstanceStatus.COMPLETED) {
            throw new InvalidTaskStateException(instanceId, instance.getStatus().getCode(), InstanceStatus.SKIPPED.getCode());
        }
        instance.skip();
        return saveAndTrigger(userId, instance);
    }

    /**
     * Move one pending instance to another time. The occurrence date it was
     * generated for stays the same, so re-materialization never recreates it.
     */
    @Transactional
    public TaskInstanceResponse rescheduleInstance(long userId, UUID instanceId, Instant scheduledDatetime) {
        Objects.requireNonNull(scheduledDatetime, "scheduledDatetime");
        var instance = findInstance(userId, instanceId);
        if (instance.getStatus() != InstanceStatus.PENDING) {
            throw new InvalidTaskStateException(instanceId, instance.getStatus().getCode(), "rescheduled");
        }
        instance.setScheduledDatetime(scheduledDatetime);
        return saveAndTrigger(userId, instance);
    }

    @Transactional
    public TaskInstanceResponse reopenInstance(long userId, UUID instanceId) {
        var instance = findInstance(userId, instanceId);
        if (instance.getStatus() == InstanceStatus.PENDING) {
            return taskMapper.toInstanceResponse(instance);
        }
        instance.reopen();
        return saveAndTrigger(userId, instance);
    }

    /**
     * Earliest pending instance from today on, per task. Tasks without one are absent.
     */
    @Transactional(readOnly = true)
    public Map<UUID, TaskInstanceResponse> getNextPendingInstances(Collection<UUID> taskIds) {
        var next = new LinkedHashMap<UUID, TaskInstanceResponse>();
        if (taskIds.isEmpty()) {
            return next;
        }
        for (var instance : instanceRepository.findUpcoming(taskIds, InstanceStatus.PENDING, today())) {
            next.putIfAbsent(instance.getTaskId(), taskMapper.toInstanceResponse(instance));
        }
        return next;
    }

    // === Helper Methods ===

    /**
     * @return true if the task left the archived state
     */
    private boolean applyStatusChange(Task task, TaskStatus requested) {
        var current = task.getStatus();
        if (requested == TaskStatus.ARCHIVED) {
            task.setStatus(TaskStatus.ARCHIVED);
            log.info("Archived task {}", task.getId());
            return false;
        }
        if (requested == TaskStatus.PENDING && current == TaskStatus.ARCHIVED) {
            task.setStatus(TaskStatus.PENDING);
            log.info("Restored task {}", task.getId());
            return true;
        }
        if (requested == TaskStatus.PENDING && current == TaskStatus.COMPLETED && !task.isRecurring()) {
            task.setStatus(TaskStatus.PENDING);
            task.setCompletedAt(null);
            return false;
        }
        throw new InvalidTaskStateException(task.getId(), current.getCode(), requested.getCode());
    }

    private TaskInstanceResponse saveAndTrigger(long userId, TaskInstance instance) {
        instance = instanceRepository.save(instance);
        log.info("Instance {} is now {}", instance.getId(), instance.getStatus().getCode());
        syncTriggerService.unitChanged(userId, UnitRef.instance(instance.getId()));
        return taskMapper.toInstanceResponse(instance);
    }

    private Task findTask(long userId, UUID taskId) {
        return taskRepository.findByIdAndUserId(taskId, userId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private TaskInstance findInstance(long userId, UUID instanceId) {
        return instanceRepository.findByIdAndUserId(instanceId, userId)
                .orElseThrow(() -> new TaskNotFoundException("Task instance", instanceId));
    }

    private static List<UnitRef> instanceRefs(List<TaskInstance> instances) {
        return instances.stream().map(instance -> UnitRef.instance(instance.getId())).toList();
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), properties.getRecurrence().getReferenceZone());
    }

    private Instant now() {
        return clock.instant();
    }
}
