package com.example.tasksync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Calendar sync state of one user as shown on the settings page
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatusResponse {

    private boolean enabled;
    private String calendarId;
    private long syncedCount;

    /**
     * Notice left by an automatic disable, cleared by the next successful sweep or re-enable
     */
    private String syncError;
    private Instant syncErrorAt;
    private Instant lastSweepAt;
}
