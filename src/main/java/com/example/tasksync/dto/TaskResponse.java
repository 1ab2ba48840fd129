package com.example.tasksync.dto;

import com.example.tasksync.domain.enums.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private UUID id;
    private Long userId;
    private String title;
    private String description;
    private Integer durationMinutes;
    private Integer impact;
    private LocalDate scheduledDate;
    private LocalTime scheduledTime;
    private boolean recurring;
    private RecurrenceRuleDto recurrenceRule;
    private LocalDate recurrenceStart;
    private LocalDate recurrenceEnd;
    private TaskStatus status;
    private Instant completedAt;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Upcoming pending instances (populated for recurring tasks on list requests)
     */
    private List<TaskInstanceResponse> nextInstances;
}
