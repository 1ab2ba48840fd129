package com.example.tasksync.domain.repository;

import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.domain.enums.InstanceStatus;
import com.example.tasksync.domain.enums.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for TaskInstance entity.
 * <p>
 * Inserts made by materialization go through {@link TaskInstanceInsertDao};
 * this repository covers reads, user actions and bulk deletes.
 */
@Repository
public interface TaskInstanceRepository extends JpaRepository<TaskInstance, UUID> {

    Optional<TaskInstance> findByIdAndUserId(UUID id, Long userId);

    List<TaskInstance> findByTaskIdOrderByOccurrenceDateAsc(UUID taskId);

    @Query("SELECT i.id FROM TaskInstance i WHERE i.taskId = :taskId")
    List<UUID> findIdsByTaskId(@Param("taskId") UUID taskId);

    @Query("""
            SELECT i.occurrenceDate FROM TaskInstance i
            WHERE i.taskId = :taskId
              AND i.occurrenceDate BETWEEN :from AND :to
            """)
    List<LocalDate> findOccurrenceDates(@Param("taskId") UUID taskId, @Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("SELECT MAX(i.occurrenceDate) FROM TaskInstance i WHERE i.taskId = :taskId")
    Optional<LocalDate> findLatestOccurrenceDate(@Param("taskId") UUID taskId);

    @Query("""
            SELECT i.id FROM TaskInstance i
            WHERE i.taskId = :taskId
              AND i.status = :status
              AND i.occurrenceDate >= :fromDate
            """)
    List<UUID> findIdsByTaskIdAndStatusFrom(@Param("taskId") UUID taskId,
                                            @Param("status") InstanceStatus status,
                                            @Param("fromDate") LocalDate fromDate);

    /**
     * Instances of a user inside a date range whose parent task is not archived.
     * The join on the parent is what keeps archived series out of calendar views.
     */
    @Query("""
            SELECT i FROM TaskInstance i
            JOIN Task t ON t.id = i.taskId
            WHERE i.userId = :userId
              AND i.occurrenceDate BETWEEN :from AND :to
              AND t.status <> :archived
            ORDER BY i.occurrenceDate ASC, i.scheduledDatetime ASC
            """)
    List<TaskInstance> findInRangeForVisibleParents(@Param("userId") Long userId,
                                                    @Param("from") LocalDate from,
                                                    @Param("to") LocalDate to,
                                                    @Param("archived") TaskStatus archived);

    /**
     * Instances whose parent is visible and carries a time, i.e. the ones mirrored to the calendar
     */
    @Query("""
            SELECT i FROM TaskInstance i
            JOIN Task t ON t.id = i.taskId
            WHERE i.userId = :userId
              AND t.status <> :archived
              AND (t.scheduledTime IS NOT NULL OR t.recurrenceRule.time IS NOT NULL)
            """)
    List<TaskInstance> findSyncableInstances(@Param("userId") Long userId, @Param("archived") TaskStatus archived);

    @Query("""
            SELECT i.id FROM TaskInstance i
            WHERE i.userId = :userId
              AND i.createdAt >= :since
            """)
    List<UUID> findIdsCreatedSince(@Param("userId") Long userId, @Param("since") Instant since);

    @Query("""
            SELECT i FROM TaskInstance i
            WHERE i.taskId IN :taskIds
              AND i.status = :status
              AND i.occurrenceDate >= :fromDate
            ORDER BY i.occurrenceDate ASC
            """)
    List<TaskInstance> findUpcoming(@Param("taskIds") Collection<UUID> taskIds,
                                    @Param("status") InstanceStatus status,
                                    @Param("fromDate") LocalDate fromDate);

    long countByStatus(InstanceStatus status);

    @Modifying
    @Query("DELETE FROM TaskInstance i WHERE i.id IN :ids")
    int deleteByIds(@Param("ids") Collection<UUID> ids);

    @Modifying
    @Query("DELETE FROM TaskInstance i WHERE i.taskId = :taskId")
    int deleteByTaskId(@Param("taskId") UUID taskId);

    /**
     * Delete resolved instances older than the cutoff. Pending ones are never matched.
     */
    @Modifying
    @Query("""
            DELETE FROM TaskInstance i
            WHERE i.status IN :statuses
              AND i.occurrenceDate < :cutoff
            """)
    int deleteResolvedBefore(@Param("cutoff") LocalDate cutoff, @Param("statuses") Collection<InstanceStatus> statuses);
}
