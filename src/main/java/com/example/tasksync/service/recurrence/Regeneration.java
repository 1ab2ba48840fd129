package com.example.tasksync.service.recurrence;

import com.example.tasksync.domain.entity.TaskInstance;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of rebuilding a task's future instances
 */
@Value
public class Regeneration {
    List<UUID> removedInstanceIds;
    List<TaskInstance> createdInstances;
}
