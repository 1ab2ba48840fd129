package com.example.tasksync.dto;

import com.example.tasksync.domain.enums.InstanceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskInstanceResponse {

    private UUID id;
    private UUID taskId;
    private LocalDate occurrenceDate;
    private Instant scheduledDatetime;
    private InstanceStatus status;
    private Instant completedAt;
}
