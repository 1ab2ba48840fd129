package com.example.tasksync.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A task or instance cannot move from its current status to the requested one,
 * e.g. completing a recurring definition or skipping a completed instance.
 */
@Getter
public class InvalidTaskStateException extends RuntimeException {

    private final UUID id;
    private final String currentState;
    private final String requestedState;

    public InvalidTaskStateException(UUID id, String currentState, String requestedState) {
        super(String.format("Cannot move %s from %s to %s", id, currentState, requestedState));
        this.id = id;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }
}
