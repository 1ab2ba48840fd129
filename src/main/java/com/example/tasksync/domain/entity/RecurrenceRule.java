package com.example.tasksync.domain.entity;

import com.example.tasksync.domain.enums.Frequency;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

/**
 * Recurrence definition embedded in a task row.
 * <p>
 * Mirrors the subset of RFC-5545 RRULE the service supports: a frequency with
 * an interval, weekday / month-day / month constraints, an "nth weekday of the
 * month" selector and an optional count or until-date end condition.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurrenceRule {

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_frequency", length = 20)
    private Frequency frequency;

    @Column(name = "rule_interval")
    @Builder.Default
    private Integer interval = 1;

    /**
     * Comma separated two-letter weekday codes, e.g. "MO,WE"
     */
    @Column(name = "rule_days_of_week", length = 30)
    private String daysOfWeek;

    @Column(name = "rule_day_of_month")
    private Integer dayOfMonth;

    /**
     * Ordinal of the weekday within the month (1..5, or -1 for the last one)
     */
    @Column(name = "rule_week_of_month")
    private Integer weekOfMonth;

    @Column(name = "rule_month_of_year")
    private Integer monthOfYear;

    /**
     * Overrides the task's scheduled time for every occurrence
     */
    @Column(name = "rule_time")
    private LocalTime time;

    @Column(name = "rule_count")
    private Integer count;

    @Column(name = "rule_until")
    private LocalDate until;

    public int getEffectiveInterval() {
        return interval != null ? interval : 1;
    }

    public List<String> getDayCodes() {
        if (daysOfWeek == null || daysOfWeek.isBlank()) {
            return List.of();
        }
        return Arrays.stream(daysOfWeek.split(","))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .map(String::toUpperCase)
                .toList();
    }
}
