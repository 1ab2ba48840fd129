package com.example.tasksync.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Lifecycle status of one materialized occurrence.
 */
@Getter
@RequiredArgsConstructor
public enum InstanceStatus {

    PENDING("pending", "Pending"),

    COMPLETED("completed", "Completed"),

    SKIPPED("skipped", "Skipped");

    private final String code;
    private final String displayName;

    public static InstanceStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown instance status code: " + code);
    }

    /**
     * Statuses the retention sweep is allowed to delete
     */
    public static List<InstanceStatus> retirable() {
        return List.of(COMPLETED, SKIPPED);
    }

    /**
     * Check if the user has already acted on this occurrence
     */
    public boolean isResolved() {
        return this == COMPLETED || this == SKIPPED;
    }
}
