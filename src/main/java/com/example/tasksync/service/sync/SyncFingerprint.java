package com.example.tasksync.service.sync;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 over the fields that end up in the calendar event. Two units with
 * equal fingerprints produce identical events.
 */
public final class SyncFingerprint {

    private SyncFingerprint() {
    }

    public static String of(SchedulableUnit unit) {
        var canonical = String.join("|",
                Objects.toString(unit.getTitle(), ""),
                Objects.toString(unit.getDescription(), ""),
                Objects.toString(unit.getDate(), ""),
                Objects.toString(unit.getTime(), ""),
                Objects.toString(unit.getDurationMinutes(), ""),
                Objects.toString(unit.getImpact(), ""),
                Objects.toString(unit.getStatus(), ""));
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
