package com.example.tasksync.dto;

import com.example.tasksync.domain.enums.SyncOutcome;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of one reconciliation sweep
 */
@Data
@NoArgsConstructor
public class SyncStats {
    private int created;
    private int updated;
    /**
     * Units whose event already matched, or that were not synced at all
     */
    private int skipped;
    private int deleted;
    private int failed;
    private boolean cancelled;
    private String error;

    public static SyncStats withError(String error) {
        var stats = new SyncStats();
        stats.setError(error);
        return stats;
    }

    public void record(SyncOutcome outcome) {
        switch (outcome) {
            case CREATED -> created++;
            case UPDATED -> updated++;
            case DELETED -> deleted++;
            case FAILED -> failed++;
            default -> skipped++;
        }
    }

    public boolean isSuccessful() {
        return error == null && !cancelled && failed == 0;
    }
}
