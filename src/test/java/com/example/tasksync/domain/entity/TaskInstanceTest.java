package com.example.tasksync.domain.entity;

import com.example.tasksync.domain.enums.InstanceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TaskInstance Entity Tests")
class TaskInstanceTest {

    private static final Instant DONE_AT = Instant.parse("2024-01-05T09:00:00Z");

    private TaskInstance instance;

    @BeforeEach
    void setUp() {
        instance = TaskInstance.builder()
                .taskId(UUID.randomUUID())
                .userId(1L)
                .occurrenceDate(LocalDate.of(2024, 1, 5))
                .build();
    }

    @Test
    @DisplayName("New instances start pending")
    void shouldStartPending() {
        assertThat(instance.getStatus()).isEqualTo(InstanceStatus.PENDING);
        assertThat(instance.getCompletedAt()).isNull();
    }

    @Test
    @DisplayName("Should record the completion time")
    void shouldComplete() {
        instance.complete(DONE_AT);

        assertThat(instance.getStatus()).isEqualTo(InstanceStatus.COMPLETED);
        assertThat(instance.getCompletedAt()).isEqualTo(DONE_AT);
    }

    @Test
    @DisplayName("Skipping clears a previous completion")
    void shouldSkip() {
        instance.complete(DONE_AT);

        instance.skip();

        assertThat(instance.getStatus()).isEqualTo(InstanceStatus.SKIPPED);
        assertThat(instance.getCompletedAt()).isNull();
    }

    @Test
    @DisplayName("Reopening returns the instance to pending")
    void shouldReopen() {
        instance.complete(DONE_AT);

        instance.reopen();

        assertThat(instance.getStatus()).isEqualTo(InstanceStatus.PENDING);
        assertThat(instance.getCompletedAt()).isNull();
    }
}
