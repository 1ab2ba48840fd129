package com.example.tasksync.domain.repository;

import com.example.tasksync.domain.entity.CalendarEventSync;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for CalendarEventSync records
 */
@Repository
public interface CalendarEventSyncRepository extends JpaRepository<CalendarEventSync, UUID> {

    Optional<CalendarEventSync> findByTaskId(UUID taskId);

    Optional<CalendarEventSync> findByTaskInstanceId(UUID taskInstanceId);

    List<CalendarEventSync> findByUserId(Long userId);

    long countByUserId(Long userId);

    @Transactional
    @Modifying
    @Query("DELETE FROM CalendarEventSync s WHERE s.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
