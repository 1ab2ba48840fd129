package com.example.tasksync.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a task or instance that does not exist for the requesting user
 */
@Getter
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String kind, UUID id) {
        super(kind + " not found: " + id);
        this.taskId = id.toString();
    }

    public TaskNotFoundException(UUID taskId) {
        this("Task", taskId);
    }
}
