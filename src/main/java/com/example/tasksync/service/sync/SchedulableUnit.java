package com.example.tasksync.service.sync;

import com.example.tasksync.domain.UnitRef;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Sync-relevant snapshot of a task or instance, taken from the database at the
 * moment of syncing. A unit without a time becomes an all-day event.
 */
@Value
@Builder
public class SchedulableUnit {
    UnitRef ref;
    Long userId;
    String title;
    String description;
    LocalDate date;
    LocalTime time;
    Integer durationMinutes;
    Integer impact;
    String status;
    boolean completed;
}
