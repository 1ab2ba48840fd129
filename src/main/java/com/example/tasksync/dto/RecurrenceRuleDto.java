package com.example.tasksync.dto;

import com.example.tasksync.domain.enums.Frequency;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Recurrence rule as accepted on task create/update and returned with the task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurrenceRuleDto {

    @NotNull(message = "Frequency is required")
    private Frequency frequency;

    @Min(value = 1, message = "Interval must be at least 1")
    private Integer interval;

    /**
     * Two-letter weekday codes, e.g. ["MO", "WE"]
     */
    private List<String> daysOfWeek;

    @Min(1)
    @Max(31)
    private Integer dayOfMonth;

    /**
     * 1..5, or -1 for the last matching weekday of the month
     */
    private Integer weekOfMonth;

    @Min(1)
    @Max(12)
    private Integer monthOfYear;

    private LocalTime time;

    @Min(1)
    private Integer count;

    private LocalDate until;
}
