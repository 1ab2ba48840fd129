package com.example.tasksync.domain.repository;

import com.example.tasksync.domain.entity.CalendarSyncSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for CalendarSyncSettings
 */
@Repository
public interface CalendarSyncSettingsRepository extends JpaRepository<CalendarSyncSettings, UUID> {

    Optional<CalendarSyncSettings> findByUserId(Long userId);

    @Query("SELECT s.userId FROM CalendarSyncSettings s WHERE s.syncEnabled = true")
    List<Long> findUserIdsWithSyncEnabled();

    long countBySyncEnabledTrue();

    /**
     * Turn sync off and store the notice shown to the user.
     *
     * @return 1 if sync was enabled before the call, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE CalendarSyncSettings s
            SET s.syncEnabled = false,
                s.syncError = :error,
                s.syncErrorAt = :now,
                s.updatedAt = :now
            WHERE s.userId = :userId
              AND s.syncEnabled = true
            """)
    int disableWithError(@Param("userId") Long userId, @Param("error") String error, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE CalendarSyncSettings s
            SET s.syncError = NULL,
                s.syncErrorAt = NULL,
                s.lastSweepAt = :now,
                s.updatedAt = :now
            WHERE s.userId = :userId
            """)
    int markSweepSucceeded(@Param("userId") Long userId, @Param("now") Instant now);
}
