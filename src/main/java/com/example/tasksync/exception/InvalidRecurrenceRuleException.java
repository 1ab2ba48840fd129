package com.example.tasksync.exception;

import lombok.Getter;

/**
 * A recurrence rule was rejected before reaching the expansion algorithm
 */
@Getter
public class InvalidRecurrenceRuleException extends IllegalArgumentException {

    private final String reason;

    public InvalidRecurrenceRuleException(String reason) {
        super("Invalid recurrence rule: " + reason);
        this.reason = reason;
    }

    public InvalidRecurrenceRuleException(String reason, Throwable cause) {
        super("Invalid recurrence rule: " + reason, cause);
        this.reason = reason;
    }
}
