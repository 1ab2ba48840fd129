package com.example.tasksync.service.sync;

import com.example.tasksync.client.ClientModels.EventDateTime;
import com.example.tasksync.client.ClientModels.ExtendedProperties;
import com.example.tasksync.client.ClientModels.GoogleEvent;
import com.example.tasksync.config.CalendarSyncProperties;
import com.example.tasksync.config.TaskSyncProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Builds the Google event body for a schedulable unit.
 */
@Component
@RequiredArgsConstructor
public class CalendarEventFactory {

    static final String UNIT_PROPERTY = "taskSyncUnit";
    static final String COMPLETED_PREFIX = "✓ ";

    // impact 1..4 -> Tomato, Tangerine, Banana, Graphite
    private static final Map<Integer, String> IMPACT_COLORS = Map.of(1, "11", 2, "6", 3, "5", 4, "8");

    private final CalendarSyncProperties calendarSyncProperties;
    private final TaskSyncProperties taskSyncProperties;

    public GoogleEvent build(SchedulableUnit unit) {
        var summary = unit.isCompleted() ? COMPLETED_PREFIX + unit.getTitle() : unit.getTitle();
        var builder = GoogleEvent.builder()
                .summary(summary)
                .description(unit.getDescription())
                .colorId(IMPACT_COLORS.get(unit.getImpact()))
                .extendedProperties(new ExtendedProperties(Map.of(UNIT_PROPERTY, unit.getRef().key())));

        if (unit.getTime() == null) {
            builder.start(EventDateTime.builder().date(unit.getDate().toString()).build())
                    .end(EventDateTime.builder().date(unit.getDate().plusDays(1).toString()).build());
        } else {
            var zone = taskSyncProperties.getRecurrence().getReferenceZone();
            var duration = unit.getDurationMinutes() != null && unit.getDurationMinutes() > 0
                    ? unit.getDurationMinutes()
                    : calendarSyncProperties.getDefaultDurationMinutes();
            var start = unit.getDate().atTime(unit.getTime()).atZone(zone);
            var end = start.plusMinutes(duration);
            builder.start(EventDateTime.builder()
                            .dateTime(start.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME))
                            .timeZone(zone.getId())
                            .build())
                    .end(EventDateTime.builder()
                            .dateTime(end.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME))
                            .timeZone(zone.getId())
                            .build());
        }
        return builder.build();
    }
}
