package com.example.tasksync.domain.enums;

/**
 * Kind of local schedulable unit mirrored to the calendar.
 */
public enum UnitType {
    /**
     * A non-recurring task
     */
    TASK,
    /**
     * One occurrence of a recurring task
     */
    INSTANCE
}
