package com.example.tasksync.domain.entity;

import com.example.tasksync.domain.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.UUID;

/**
 * A user's task. One-off tasks are schedulable units on their own; recurring
 * tasks are definitions whose occurrences live in {@link TaskInstance}.
 */
@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_task_user_status", columnList = "user_id, status"),
        @Index(name = "idx_task_user_scheduled_date", columnList = "user_id, scheduled_date"),
        @Index(name = "idx_task_recurring_status", columnList = "is_recurring, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task {

    public static final int DEFAULT_IMPACT = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    /**
     * Priority from 1 (highest) to 4 (lowest)
     */
    @Column(name = "impact", nullable = false)
    @Builder.Default
    private Integer impact = DEFAULT_IMPACT;

    @Column(name = "scheduled_date")
    private LocalDate scheduledDate;

    /**
     * Default time-of-day, also used for every instance of a recurring task
     */
    @Column(name = "scheduled_time")
    private LocalTime scheduledTime;

    @Column(name = "is_recurring", nullable = false)
    @Builder.Default
    private boolean recurring = false;

    @Embedded
    private RecurrenceRule recurrenceRule;

    @Column(name = "recurrence_start")
    private LocalDate recurrenceStart;

    @Column(name = "recurrence_end")
    private LocalDate recurrenceEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.status == null) {
            this.status = TaskStatus.PENDING;
        }
        if (this.impact == null) {
            this.impact = DEFAULT_IMPACT;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isArchived() {
        return status == TaskStatus.ARCHIVED;
    }

    /**
     * Check if the task has a rule that the recurrence engine should expand
     */
    public boolean isActiveRecurrence() {
        return recurring && recurrenceRule != null && recurrenceRule.getFrequency() != null
                && status == TaskStatus.PENDING;
    }

    /**
     * Date the task is shown on: its scheduled date, or for a completed task
     * without one, the day it was completed.
     */
    public LocalDate getEffectiveDate(ZoneId zone) {
        if (scheduledDate != null) {
            return scheduledDate;
        }
        if (status == TaskStatus.COMPLETED && completedAt != null) {
            return LocalDate.ofInstant(completedAt, zone);
        }
        return null;
    }

    /**
     * Time every instance is scheduled at: the rule's time, else the task's
     */
    public LocalTime getOccurrenceTime() {
        if (recurrenceRule != null && recurrenceRule.getTime() != null) {
            return recurrenceRule.getTime();
        }
        return scheduledTime;
    }
}
