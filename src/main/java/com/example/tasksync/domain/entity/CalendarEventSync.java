package com.example.tasksync.domain.entity;

import com.example.tasksync.domain.UnitRef;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Link between one local schedulable unit and the calendar event mirroring it.
 * <p>
 * Exactly one of taskId / taskInstanceId is set. Each is unique on its own,
 * which makes a second concurrent insert for the same unit fail. There is no
 * foreign key to the unit: a record outliving its unit is an orphan that the
 * reconciliation sweep removes together with the remote event.
 */
@Entity
@Table(name = "calendar_event_syncs",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_event_sync_task", columnNames = "task_id"),
                @UniqueConstraint(name = "uq_event_sync_instance", columnNames = "task_instance_id")
        },
        indexes = @Index(name = "idx_event_sync_user", columnList = "user_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalendarEventSync {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "task_id", updatable = false)
    private UUID taskId;

    @Column(name = "task_instance_id", updatable = false)
    private UUID taskInstanceId;

    @Column(name = "google_event_id", nullable = false)
    private String googleEventId;

    /**
     * SHA-256 of the fields last pushed
     */
    @Column(name = "sync_hash", nullable = false, length = 64)
    private String syncHash;

    @Column(name = "last_synced_at", nullable = false)
    private Instant lastSyncedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    public UnitRef getUnitRef() {
        return taskId != null ? UnitRef.task(taskId) : UnitRef.instance(taskInstanceId);
    }

    public static CalendarEventSyncBuilder forUnit(UnitRef ref) {
        var builder = builder();
        return switch (ref.getType()) {
            case TASK -> builder.taskId(ref.getId());
            case INSTANCE -> builder.taskInstanceId(ref.getId());
        };
    }
}
