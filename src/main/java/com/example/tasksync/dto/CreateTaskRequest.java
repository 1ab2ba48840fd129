package com.example.tasksync.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Request DTO for creating a task, one-off or recurring
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 500)
    private String title;

    private String description;

    @Min(1)
    private Integer durationMinutes;

    /**
     * 1 (highest) to 4 (lowest), default 4
     */
    @Min(1)
    @Max(4)
    private Integer impact;

    private LocalDate scheduledDate;

    private LocalTime scheduledTime;

    private boolean recurring;

    @Valid
    private RecurrenceRuleDto recurrenceRule;

    /**
     * First day the rule may produce an occurrence (default: today)
     */
    private LocalDate recurrenceStart;

    private LocalDate recurrenceEnd;
}
