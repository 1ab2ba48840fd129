package com.example.tasksync.domain.entity;

import com.example.tasksync.domain.enums.Frequency;
import com.example.tasksync.domain.enums.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Task Entity Tests")
class TaskTest {

    private Task task;

    @BeforeEach
    void setUp() {
        task = Task.builder()
                .userId(1L)
                .title("Water plants")
                .build();
    }

    @Nested
    @DisplayName("isActiveRecurrence Tests")
    class IsActiveRecurrenceTests {

        @Test
        @DisplayName("Should return false for a one-off task")
        void shouldReturnFalseForOneOff() {
            assertThat(task.isActiveRecurrence()).isFalse();
        }

        @Test
        @DisplayName("Should return true for a pending task with a rule")
        void shouldReturnTrueForPendingRecurringTask() {
            task.setRecurring(true);
            task.setRecurrenceRule(RecurrenceRule.builder().frequency(Frequency.DAILY).build());
            assertThat(task.isActiveRecurrence()).isTrue();
        }

        @Test
        @DisplayName("Should return false once archived")
        void shouldReturnFalseWhenArchived() {
            task.setRecurring(true);
            task.setRecurrenceRule(RecurrenceRule.builder().frequency(Frequency.DAILY).build());
            task.setStatus(TaskStatus.ARCHIVED);
            assertThat(task.isActiveRecurrence()).isFalse();
            assertThat(task.isArchived()).isTrue();
        }

        @Test
        @DisplayName("Should return false when the rule has no frequency")
        void shouldReturnFalseWithoutFrequency() {
            task.setRecurring(true);
            task.setRecurrenceRule(RecurrenceRule.builder().build());
            assertThat(task.isActiveRecurrence()).isFalse();
        }
    }

    @Nested
    @DisplayName("getEffectiveDate Tests")
    class EffectiveDateTests {

        @Test
        @DisplayName("Should prefer the scheduled date")
        void shouldUseScheduledDate() {
            task.setScheduledDate(LocalDate.of(2024, 3, 1));
            task.setStatus(TaskStatus.COMPLETED);
            task.setCompletedAt(Instant.parse("2024-02-10T10:00:00Z"));
            assertThat(task.getEffectiveDate(ZoneOffset.UTC)).isEqualTo(LocalDate.of(2024, 3, 1));
        }

        @Test
        @DisplayName("Should fall back to the completion day for completed tasks")
        void shouldUseCompletionDay() {
            task.setStatus(TaskStatus.COMPLETED);
            task.setCompletedAt(Instant.parse("2024-02-10T23:30:00Z"));
            assertThat(task.getEffectiveDate(ZoneOffset.UTC)).isEqualTo(LocalDate.of(2024, 2, 10));
        }

        @Test
        @DisplayName("Should return null for an undated pending task")
        void shouldReturnNullWithoutDate() {
            assertThat(task.getEffectiveDate(ZoneOffset.UTC)).isNull();
        }
    }

    @Nested
    @DisplayName("getOccurrenceTime Tests")
    class OccurrenceTimeTests {

        @Test
        @DisplayName("Rule time overrides the task time")
        void shouldPreferRuleTime() {
            task.setScheduledTime(LocalTime.of(8, 0));
            task.setRecurrenceRule(RecurrenceRule.builder().frequency(Frequency.DAILY).time(LocalTime.of(18, 15)).build());
            assertThat(task.getOccurrenceTime()).isEqualTo(LocalTime.of(18, 15));
        }

        @Test
        @DisplayName("Should use the task time when the rule has none")
        void shouldFallBackToTaskTime() {
            task.setScheduledTime(LocalTime.of(8, 0));
            task.setRecurrenceRule(RecurrenceRule.builder().frequency(Frequency.DAILY).build());
            assertThat(task.getOccurrenceTime()).isEqualTo(LocalTime.of(8, 0));
        }
    }

    @Test
    @DisplayName("Builder defaults to pending with the lowest impact")
    void shouldApplyBuilderDefaults() {
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.getImpact()).isEqualTo(Task.DEFAULT_IMPACT);
        assertThat(task.isRecurring()).isFalse();
    }
}
