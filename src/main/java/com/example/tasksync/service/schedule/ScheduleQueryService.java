package com.example.tasksync.service.schedule;

import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.TaskInstanceRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import com.example.tasksync.dto.DaySchedule;
import com.example.tasksync.dto.ScheduledUnitView;
import com.example.tasksync.mapper.TaskMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Calendar-facing read path.
 * <p>
 * For every date in a range: one-off tasks scheduled that day, plus instances
 * whose parent task is not archived. Archived parents are excluded by the query
 * and checked again here, since an archived series leaves its pending instances behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleQueryService {

    private final TaskRepository taskRepository;
    private final TaskInstanceRepository instanceRepository;
    private final TaskMapper taskMapper;

    /**
     * @return one entry per date from {@code from} to {@code to} inclusive, empty days included
     */
    @Transactional(readOnly = true)
    public List<DaySchedule> getSchedulableUnits(long userId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before its start " + from);
        }

        var days = new LinkedHashMap<LocalDate, List<ScheduledUnitView>>();
        for (var date = from; !date.isAfter(to); date = date.plusDays(1)) {
            days.put(date, new ArrayList<>());
        }

        for (var task : taskRepository.findOneOffTasksInRange(userId, from, to, TaskStatus.ARCHIVED)) {
            if (!task.isArchived()) {
                days.get(task.getScheduledDate()).add(taskMapper.toView(task));
            }
        }

        var instances = instanceRepository.findInRangeForVisibleParents(userId, from, to, TaskStatus.ARCHIVED);
        var parents = taskRepository.findAllById(instances.stream().map(TaskInstance::getTaskId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Task::getId, Function.identity()));
        for (var instance : instances) {
            var parent = parents.get(instance.getTaskId());
            if (parent == null || parent.isArchived()) {
                continue;
            }
            days.get(instance.getOccurrenceDate()).add(taskMapper.toView(instance, parent));
        }

        log.debug("Schedule for user {} from {} to {}: {} instances", userId, from, to, instances.size());
        return days.entrySet().stream()
                .map(entry -> new DaySchedule(entry.getKey(), entry.getValue()))
                .toList();
    }
}
