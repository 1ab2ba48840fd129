package com.example.tasksync.domain.repository;

import com.example.tasksync.domain.entity.GoogleToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for GoogleToken.
 * <p>
 * The refresh lease is a compare-and-swap on refresh_locked_by / refresh_locked_until:
 * a caller owns the lease only if its update matched the row. Each modifying
 * method commits on its own so other callers see the lease immediately.
 */
@Repository
public interface GoogleTokenRepository extends JpaRepository<GoogleToken, UUID> {

    Optional<GoogleToken> findByUserId(Long userId);

    /**
     * Try to take the refresh lease without blocking.
     *
     * @return 1 if the lease was acquired, 0 if another caller holds a live lease
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE GoogleToken t
            SET t.refreshLockedBy = :owner,
                t.refreshLockedUntil = :lockUntil
            WHERE t.userId = :userId
              AND (t.refreshLockedBy IS NULL OR t.refreshLockedUntil < :now)
            """)
    int tryAcquireRefreshLock(@Param("userId") Long userId,
                              @Param("owner") String owner,
                              @Param("lockUntil") Instant lockUntil,
                              @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE GoogleToken t
            SET t.refreshLockedBy = NULL,
                t.refreshLockedUntil = NULL
            WHERE t.userId = :userId
              AND t.refreshLockedBy = :owner
            """)
    int releaseRefreshLock(@Param("userId") Long userId, @Param("owner") String owner);

    /**
     * Store a refreshed access token. A null refresh token keeps the current one.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE GoogleToken t
            SET t.accessToken = :accessToken,
                t.refreshToken = COALESCE(:refreshToken, t.refreshToken),
                t.expiresAt = :expiresAt,
                t.updatedAt = :now
            WHERE t.userId = :userId
            """)
    int updateTokens(@Param("userId") Long userId,
                     @Param("accessToken") String accessToken,
                     @Param("refreshToken") String refreshToken,
                     @Param("expiresAt") Instant expiresAt,
                     @Param("now") Instant now);

    /**
     * Mark the access token as expired so the next caller refreshes it.
     * No-op once the row holds a different token than the one that was rejected.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE GoogleToken t
            SET t.expiresAt = :now,
                t.updatedAt = :now
            WHERE t.userId = :userId
              AND t.accessToken = :accessToken
            """)
    int expireAccessToken(@Param("userId") Long userId, @Param("accessToken") String accessToken,
                          @Param("now") Instant now);
}
