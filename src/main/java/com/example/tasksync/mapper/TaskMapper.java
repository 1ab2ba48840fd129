package com.example.tasksync.mapper;

import com.example.tasksync.domain.entity.RecurrenceRule;
import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.dto.RecurrenceRuleDto;
import com.example.tasksync.dto.ScheduledUnitView;
import com.example.tasksync.dto.TaskInstanceResponse;
import com.example.tasksync.dto.TaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.Arrays;
import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TaskMapper {

    TaskResponse toResponse(Task task);

    List<TaskResponse> toResponseList(List<Task> tasks);

    TaskInstanceResponse toInstanceResponse(TaskInstance instance);

    List<TaskInstanceResponse> toInstanceResponses(List<TaskInstance> instances);

    RecurrenceRuleDto toRuleDto(RecurrenceRule rule);

    RecurrenceRule toRule(RecurrenceRuleDto dto);

    /**
     * Calendar view of a one-off task
     */
    @Mapping(target = "type", constant = "TASK")
    @Mapping(target = "taskId", source = "id")
    @Mapping(target = "time", source = "scheduledTime")
    @Mapping(target = "status", source = "status.code")
    @Mapping(target = "scheduledDatetime", ignore = true)
    ScheduledUnitView toView(Task task);

    /**
     * Calendar view of an instance; display fields come from the parent task
     */
    @Mapping(target = "type", constant = "INSTANCE")
    @Mapping(target = "id", source = "instance.id")
    @Mapping(target = "taskId", source = "instance.taskId")
    @Mapping(target = "title", source = "parent.title")
    @Mapping(target = "time", source = "parent.occurrenceTime")
    @Mapping(target = "scheduledDatetime", source = "instance.scheduledDatetime")
    @Mapping(target = "durationMinutes", source = "parent.durationMinutes")
    @Mapping(target = "impact", source = "parent.impact")
    @Mapping(target = "status", source = "instance.status.code")
    ScheduledUnitView toView(TaskInstance instance, Task parent);

    default String joinDays(List<String> days) {
        if (days == null || days.isEmpty()) {
            return null;
        }
        return String.join(",", days.stream().map(String::toUpperCase).toList());
    }

    default List<String> splitDays(String days) {
        if (days == null || days.isBlank()) {
            return List.of();
        }
        return Arrays.stream(days.split(",")).map(String::trim).toList();
    }
}
