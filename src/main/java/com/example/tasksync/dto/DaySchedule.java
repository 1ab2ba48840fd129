package com.example.tasksync.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DaySchedule {

    private LocalDate date;
    private List<ScheduledUnitView> units;
}
