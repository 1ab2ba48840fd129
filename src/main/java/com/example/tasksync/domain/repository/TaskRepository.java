package com.example.tasksync.domain.repository;

import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.enums.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Task entity.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, UUID> {

    Optional<Task> findByIdAndUserId(UUID id, Long userId);

    List<Task> findByUserIdAndRecurringTrueAndStatus(Long userId, TaskStatus status);

    /**
     * Users that own at least one recurring task still being materialized
     */
    @Query("""
            SELECT DISTINCT t.userId FROM Task t
            WHERE t.recurring = true
              AND t.status = :status
            """)
    List<Long> findUserIdsWithRecurringStatus(@Param("status") TaskStatus status);

    /**
     * One-off tasks of a user that can have a calendar event: not archived and
     * carrying a scheduled date or a completion timestamp.
     */
    @Query("""
            SELECT t FROM Task t
            WHERE t.userId = :userId
              AND t.recurring = false
              AND t.status <> :archived
              AND (t.scheduledDate IS NOT NULL OR t.completedAt IS NOT NULL)
            """)
    List<Task> findSyncableOneOffTasks(@Param("userId") Long userId, @Param("archived") TaskStatus archived);

    /**
     * One-off tasks scheduled inside a date range, archived ones excluded
     */
    @Query("""
            SELECT t FROM Task t
            WHERE t.userId = :userId
              AND t.recurring = false
              AND t.status <> :archived
              AND t.scheduledDate BETWEEN :from AND :to
            ORDER BY t.scheduledDate ASC, t.scheduledTime ASC
            """)
    List<Task> findOneOffTasksInRange(@Param("userId") Long userId,
                                      @Param("from") LocalDate from,
                                      @Param("to") LocalDate to,
                                      @Param("archived") TaskStatus archived);

    /**
     * One-off tasks created at or after the given instant
     */
    @Query("""
            SELECT t.id FROM Task t
            WHERE t.userId = :userId
              AND t.recurring = false
              AND t.createdAt >= :since
            """)
    List<UUID> findOneOffTaskIdsCreatedSince(@Param("userId") Long userId, @Param("since") Instant since);
}
