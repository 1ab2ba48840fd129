package com.example.tasksync.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Google OAuth credential of one user plus the lease taken while refreshing it.
 * <p>
 * Only the token lifecycle manager writes this row, through conditional
 * updates on refreshLockedBy / refreshLockedUntil.
 */
@Entity
@Table(name = "google_tokens")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GoogleToken {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true, updatable = false)
    private Long userId;

    @Column(name = "access_token", nullable = false, columnDefinition = "TEXT")
    private String accessToken;

    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private String refreshToken;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "refresh_locked_by", length = 100)
    private String refreshLockedBy;

    @Column(name = "refresh_locked_until")
    private Instant refreshLockedUntil;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        this.updatedAt = Instant.now();
    }

    /**
     * Check if the access token is still usable at the given instant, keeping a safety margin
     */
    public boolean isValidAt(Instant now, Duration margin) {
        return accessToken != null && expiresAt != null && expiresAt.isAfter(now.plus(margin));
    }
}
