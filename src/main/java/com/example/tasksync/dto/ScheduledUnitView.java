package com.example.tasksync.dto;

import com.example.tasksync.domain.enums.UnitType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;
import java.util.UUID;

/**
 * A one-off task or an instance as it appears on a calendar day
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledUnitView {

    private UnitType type;
    private UUID id;

    /**
     * Owning task; equals {@code id} for one-off tasks
     */
    private UUID taskId;
    private String title;
    private LocalTime time;
    private Instant scheduledDatetime;
    private Integer durationMinutes;
    private Integer impact;
    private String status;
}
