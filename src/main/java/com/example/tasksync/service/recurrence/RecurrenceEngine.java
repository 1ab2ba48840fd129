package com.example.tasksync.service.recurrence;

import com.example.tasksync.domain.entity.RecurrenceRule;
import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.enums.Frequency;
import com.example.tasksync.exception.InvalidRecurrenceRuleException;
import lombok.extern.slf4j.Slf4j;
import net.fortuna.ical4j.model.Recur;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.StringJoiner;

/**
 * Expands a task's recurrence rule into occurrence dates inside the horizon window.
 * <p>
 * The rule is rendered as an RFC-5545 RRULE and expanded by iCal4j, seeded at the
 * recurrence start so COUNT and INTERVAL are measured from the rule's origin.
 * Dates that do not exist in a given month (the 31st in a 30-day month, Feb 29 in
 * common years) are skipped, as RFC-5545 prescribes; nothing is clamped.
 * <p>
 * Window: {@code max(start, today) <= d < today + horizonDays}, further bounded by
 * the task's recurrence end and the rule's until-date, both inclusive.
 */
@Slf4j
@Component
public class RecurrenceEngine {

    public List<LocalDate> occurrences(Task task, LocalDate ruleStart, LocalDate today, int horizonDays) {
        var rule = task.getRecurrenceRule();
        var windowStart = ruleStart.isAfter(today) ? ruleStart : today;
        var windowEnd = today.plusDays(horizonDays);
        if (task.getRecurrenceEnd() != null && task.getRecurrenceEnd().plusDays(1).isBefore(windowEnd)) {
            windowEnd = task.getRecurrenceEnd().plusDays(1);
        }
        if (rule.getUntil() != null && rule.getUntil().plusDays(1).isBefore(windowEnd)) {
            windowEnd = rule.getUntil().plusDays(1);
        }
        if (!windowStart.isBefore(windowEnd)) {
            return List.of();
        }

        var recur = parse(toRRule(rule, ruleStart));
        var from = windowStart;
        var to = windowEnd;
        var dates = recur.getDates(ruleStart, windowStart, windowEnd).stream()
                .filter(date -> !date.isBefore(from) && date.isBefore(to))
                .distinct()
                .sorted()
                .toList();
        log.debug("Task {} expands to {} dates in [{}, {})", task.getId(), dates.size(), windowStart, windowEnd);
        return dates;
    }

    /**
     * Render the rule as an RRULE value. Selectors the rule leaves open are taken
     * from the start date, so a monthly rule without a day repeats on the start's day.
     */
    String toRRule(RecurrenceRule rule, LocalDate start) {
        var parts = new StringJoiner(";");
        parts.add("FREQ=" + rule.getFrequency().getRruleValue());
        parts.add("INTERVAL=" + rule.getEffectiveInterval());

        var days = rule.getDayCodes();
        var frequency = rule.getFrequency();
        if (frequency == Frequency.DAILY && !days.isEmpty()) {
            parts.add("BYDAY=" + String.join(",", days));
        } else if (frequency == Frequency.WEEKLY) {
            parts.add("BYDAY=" + (days.isEmpty() ? dayCode(start.getDayOfWeek()) : String.join(",", days)));
        } else if (frequency == Frequency.MONTHLY || frequency == Frequency.YEARLY) {
            if (frequency == Frequency.YEARLY) {
                parts.add("BYMONTH=" + (rule.getMonthOfYear() != null ? rule.getMonthOfYear() : start.getMonthValue()));
            }
            if (rule.getWeekOfMonth() != null) {
                parts.add("BYDAY=" + rule.getWeekOfMonth() + days.get(0));
            } else if (frequency == Frequency.MONTHLY && rule.getDayOfMonth() == null && !days.isEmpty()) {
                parts.add("BYDAY=" + String.join(",", days));
            } else {
                parts.add("BYMONTHDAY=" + (rule.getDayOfMonth() != null ? rule.getDayOfMonth() : start.getDayOfMonth()));
            }
        }

        if (rule.getCount() != null) {
            parts.add("COUNT=" + rule.getCount());
        }
        return parts.toString();
    }

    private static Recur<LocalDate> parse(String rrule) {
        try {
            return new Recur<>(rrule);
        } catch (Exception e) {
            throw new InvalidRecurrenceRuleException("cannot expand " + rrule, e);
        }
    }

    private static String dayCode(DayOfWeek day) {
        return day.name().substring(0, 2);
    }
}
