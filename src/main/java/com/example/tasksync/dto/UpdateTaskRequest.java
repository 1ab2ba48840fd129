package com.example.tasksync.dto;

import com.example.tasksync.domain.enums.TaskStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Partial update of a task. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTaskRequest {

    @Size(max = 500)
    private String title;

    private String description;

    @Min(1)
    private Integer durationMinutes;

    @Min(1)
    @Max(4)
    private Integer impact;

    private LocalDate scheduledDate;

    private LocalTime scheduledTime;

    /**
     * Replaces the rule; future pending instances are rebuilt
     */
    @Valid
    private RecurrenceRuleDto recurrenceRule;

    private LocalDate recurrenceStart;

    private LocalDate recurrenceEnd;

    /**
     * PENDING or ARCHIVED; completion has its own operation
     */
    private TaskStatus status;
}
