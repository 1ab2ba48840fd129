package com.example.tasksync.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle status of a task definition.
 */
@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    /**
     * Active task. For a recurring task this is the only status that gets materialized.
     */
    PENDING("pending", "Pending"),

    /**
     * A one-off task the user has finished.
     */
    COMPLETED("completed", "Completed"),

    /**
     * Hidden from every calendar-facing view. Existing instances stay in place.
     */
    ARCHIVED("archived", "Archived");

    private final String code;
    private final String displayName;

    public static TaskStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
