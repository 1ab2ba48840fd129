package com.example.tasksync.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Recurrence frequency, mapped onto the RFC-5545 FREQ values.
 */
@Getter
@RequiredArgsConstructor
public enum Frequency {

    DAILY("daily", "DAILY"),
    WEEKLY("weekly", "WEEKLY"),
    MONTHLY("monthly", "MONTHLY"),
    YEARLY("yearly", "YEARLY");

    private final String code;
    private final String rruleValue;

    public static Frequency fromCode(String code) {
        for (var frequency : values()) {
            if (frequency.getCode().equalsIgnoreCase(code)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown recurrence frequency: " + code);
    }
}
