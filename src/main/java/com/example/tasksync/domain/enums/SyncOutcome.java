package com.example.tasksync.domain.enums;

/**
 * Result of pushing one unit to the calendar.
 */
public enum SyncOutcome {
    CREATED,
    UPDATED,
    UNCHANGED,
    DELETED,
    /**
     * Sync is disabled for the user
     */
    SKIPPED,
    FAILED
}
