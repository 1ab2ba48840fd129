package com.example.tasksync.domain.entity;

import com.example.tasksync.domain.enums.InstanceStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One concrete occurrence of a recurring task.
 * <p>
 * The pair (task_id, occurrence_date) is unique; materialization relies on
 * that constraint to stay idempotent under concurrent runs.
 */
@Entity
@Table(name = "task_instances",
        uniqueConstraints = @UniqueConstraint(name = "uq_task_instance_date", columnNames = {"task_id", "occurrence_date"}),
        indexes = {
                @Index(name = "idx_instance_user_date", columnList = "user_id, occurrence_date"),
                @Index(name = "idx_instance_status_date", columnList = "status, occurrence_date")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskInstance {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "occurrence_date", nullable = false, updatable = false)
    private LocalDate occurrenceDate;

    /**
     * Occurrence date combined with the task's time in the reference timezone
     */
    @Column(name = "scheduled_datetime")
    private Instant scheduledDatetime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private InstanceStatus status = InstanceStatus.PENDING;

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
        if (this.id == null) {
            this.id = UUID.randomUUID();
        }
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.status == null) {
            this.status = InstanceStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public void complete(Instant at) {
        this.status = InstanceStatus.COMPLETED;
        this.completedAt = at;
    }

    public void skip() {
        this.status = InstanceStatus.SKIPPED;
        this.completedAt = null;
    }

    public void reopen() {
        this.status = InstanceStatus.PENDING;
        this.completedAt = null;
    }
}
