package com.example.tasksync.service.recurrence;

import com.example.tasksync.domain.entity.RecurrenceRule;
import com.example.tasksync.domain.enums.Frequency;
import com.example.tasksync.exception.InvalidRecurrenceRuleException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Set;

/**
 * Rejects rules the expansion cannot handle before they are stored.
 * The engine assumes every rule it sees passed this check.
 */
@Component
public class RecurrenceRuleValidator {

    private static final Set<String> DAY_CODES = Set.of("MO", "TU", "WE", "TH", "FR", "SA", "SU");

    public void validate(RecurrenceRule rule, LocalDate start, LocalDate end) {
        if (rule == null || rule.getFrequency() == null) {
            throw new InvalidRecurrenceRuleException("frequency is required");
        }
        if (rule.getInterval() != null && rule.getInterval() < 1) {
            throw new InvalidRecurrenceRuleException("interval must be at least 1, got " + rule.getInterval());
        }

        var days = rule.getDayCodes();
        for (var day : days) {
            if (!DAY_CODES.contains(day)) {
                throw new InvalidRecurrenceRuleException("unknown weekday code " + day);
            }
        }

        if (rule.getDayOfMonth() != null && (rule.getDayOfMonth() < 1 || rule.getDayOfMonth() > 31)) {
            throw new InvalidRecurrenceRuleException("day of month must be between 1 and 31");
        }
        if (rule.getMonthOfYear() != null && (rule.getMonthOfYear() < 1 || rule.getMonthOfYear() > 12)) {
            throw new InvalidRecurrenceRuleException("month of year must be between 1 and 12");
        }

        if (rule.getWeekOfMonth() != null) {
            var week = rule.getWeekOfMonth();
            if (week != -1 && (week < 1 || week > 5)) {
                throw new InvalidRecurrenceRuleException("week of month must be 1..5 or -1");
            }
            if (rule.getFrequency() != Frequency.MONTHLY && rule.getFrequency() != Frequency.YEARLY) {
                throw new InvalidRecurrenceRuleException("week of month needs a monthly or yearly frequency");
            }
            if (days.size() != 1) {
                throw new InvalidRecurrenceRuleException("week of month needs exactly one weekday");
            }
            if (rule.getDayOfMonth() != null) {
                throw new InvalidRecurrenceRuleException("week of month and day of month cannot be combined");
            }
        }

        if (rule.getCount() != null && rule.getCount() < 1) {
            throw new InvalidRecurrenceRuleException("count must be at least 1");
        }
        if (rule.getCount() != null && rule.getUntil() != null) {
            throw new InvalidRecurrenceRuleException("count and until are mutually exclusive");
        }
        if (start != null && rule.getUntil() != null && rule.getUntil().isBefore(start)) {
            throw new InvalidRecurrenceRuleException("until is before the recurrence start");
        }
        if (start != null && end != null && end.isBefore(start)) {
            throw new InvalidRecurrenceRuleException("recurrence end is before its start");
        }
    }
}
