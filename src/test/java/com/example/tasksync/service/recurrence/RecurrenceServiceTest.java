package com.example.tasksync.service.recurrence;

import com.example.tasksync.config.MetricsConfig;
import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.entity.RecurrenceRule;
import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.domain.enums.Frequency;
import com.example.tasksync.domain.enums.InstanceStatus;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.TaskInstanceInsertDao;
import com.example.tasksync.domain.repository.TaskInstanceRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecurrenceService Tests")
class RecurrenceServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 1);

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private TaskInstanceRepository instanceRepository;

    @Mock
    private TaskInstanceInsertDao instanceInsertDao;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<Collection<InstanceStatus>> statusesCaptor;

    private TaskSyncProperties properties;
    private RecurrenceService recurrenceService;

    /**
     * In-memory stand-in for the task_instances unique key (task_id, occurrence_date)
     */
    private final Map<UUID, List<LocalDate>> storedDates = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        properties = new TaskSyncProperties();
        properties.getRecurrence().setHorizonDays(14);
        var clock = Clock.fixed(Instant.parse("2024-01-01T08:00:00Z"), ZoneOffset.UTC);
        recurrenceService = new RecurrenceService(taskRepository, instanceRepository, instanceInsertDao,
                new RecurrenceEngine(), properties, metricsConfig, clock);
    }

    private Task mondayWednesdayTask() {
        return Task.builder()
                .id(UUID.randomUUID())
                .userId(7L)
                .title("Standup")
                .scheduledTime(LocalTime.of(9, 30))
                .recurring(true)
                .recurrenceRule(RecurrenceRule.builder().frequency(Frequency.WEEKLY).daysOfWeek("MO,WE").build())
                .recurrenceStart(TODAY)
                .status(TaskStatus.PENDING)
                .build();
    }

    private void backInsertsWithMemory() {
        lenient().when(instanceRepository.findOccurrenceDates(any(), any(), any()))
                .thenAnswer(inv -> List.copyOf(storedDates.getOrDefault(inv.<UUID>getArgument(0), List.of())));
        when(instanceInsertDao.insertIfAbsent(any(TaskInstance.class))).thenAnswer(inv -> {
            TaskInstance instance = inv.getArgument(0);
            var dates = storedDates.computeIfAbsent(instance.getTaskId(), id -> new ArrayList<>());
            synchronized (dates) {
                if (dates.contains(instance.getOccurrenceDate())) {
                    return false;
                }
                dates.add(instance.getOccurrenceDate());
                return true;
            }
        });
    }

    @Nested
    @DisplayName("Materialization Tests")
    class MaterializationTests {

        @Test
        @DisplayName("Should be idempotent when run twice")
        void shouldBeIdempotent() {
            // Given
            backInsertsWithMemory();
            var task = mondayWednesdayTask();

            // When
            var first = recurrenceService.materialize(task);
            var second = recurrenceService.materialize(task);

            // Then
            assertThat(first).hasSize(4);
            assertThat(second).isEmpty();
            assertThat(storedDates.get(task.getId())).hasSize(4).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Should keep other inserts when one date loses a concurrent insert")
        void shouldKeepOtherInsertsOnConflict() {
            // Given
            var task = mondayWednesdayTask();
            when(instanceRepository.findOccurrenceDates(any(), any(), any())).thenReturn(List.of());
            when(instanceInsertDao.insertIfAbsent(any(TaskInstance.class)))
                    .thenAnswer(inv -> !inv.<TaskInstance>getArgument(0).getOccurrenceDate().equals(LocalDate.of(2024, 1, 3)));

            // When
            var created = recurrenceService.materialize(task);

            // Then
            assertThat(created).extracting(TaskInstance::getOccurrenceDate)
                    .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 10));
            verify(metricsConfig).recordMaterialized(3);
        }

        @Test
        @DisplayName("Should combine date and time in the reference timezone")
        void shouldComputeScheduledDatetime() {
            // Given
            backInsertsWithMemory();
            var task = mondayWednesdayTask();

            // When
            var created = recurrenceService.materialize(task);

            // Then
            assertThat(created.get(0).getScheduledDatetime()).isEqualTo(Instant.parse("2024-01-01T09:30:00Z"));
            assertThat(created).allMatch(i -> i.getStatus() == InstanceStatus.PENDING && i.getUserId() == 7L);
        }

        @Test
        @DisplayName("Should leave scheduled datetime empty for untimed tasks")
        void shouldLeaveDatetimeEmptyWithoutTime() {
            // Given
            backInsertsWithMemory();
            var task = mondayWednesdayTask();
            task.setScheduledTime(null);

            // When
            var created = recurrenceService.materialize(task);

            // Then
            assertThat(created).isNotEmpty().allMatch(i -> i.getScheduledDatetime() == null);
        }

        @Test
        @DisplayName("Should not materialize archived tasks")
        void shouldSkipArchivedTask() {
            // Given
            var task = mondayWednesdayTask();
            task.setStatus(TaskStatus.ARCHIVED);

            // When
            var created = recurrenceService.materialize(task);

            // Then
            assertThat(created).isEmpty();
            verifyNoInteractions(instanceInsertDao);
        }
    }

    @Nested
    @DisplayName("Horizon Top-up Tests")
    class TopUpTests {

        @Test
        @DisplayName("Should top up only tasks whose latest instance is near the horizon end")
        void shouldTopUpStaleTasks() {
            // Given
            properties.getRecurrence().setRefreshThresholdDays(7);
            var fresh = mondayWednesdayTask();
            var stale = mondayWednesdayTask();
            when(taskRepository.findByUserIdAndRecurringTrueAndStatus(7L, TaskStatus.PENDING)).thenReturn(List.of(fresh, stale));
            when(instanceRepository.findLatestOccurrenceDate(fresh.getId())).thenReturn(Optional.of(TODAY.plusDays(10)));
            when(instanceRepository.findLatestOccurrenceDate(stale.getId())).thenReturn(Optional.empty());
            backInsertsWithMemory();

            // When
            var created = recurrenceService.ensureMaterialized(7L);

            // Then
            assertThat(created).hasSize(4).allMatch(i -> i.getTaskId().equals(stale.getId()));
            assertThat(storedDates).doesNotContainKey(fresh.getId());
        }
    }

    @Nested
    @DisplayName("Regeneration Tests")
    class RegenerationTests {

        @Test
        @DisplayName("Should delete future pending instances before re-expanding")
        void shouldDeleteFuturePendingAndRematerialize() {
            // Given
            var task = mondayWednesdayTask();
            var removed = List.of(UUID.randomUUID(), UUID.randomUUID());
            when(instanceRepository.findIdsByTaskIdAndStatusFrom(task.getId(), InstanceStatus.PENDING, TODAY)).thenReturn(removed);
            backInsertsWithMemory();

            // When
            var regeneration = recurrenceService.regenerate(task);

            // Then
            verify(instanceRepository).deleteByIds(removed);
            assertThat(regeneration.getRemovedInstanceIds()).isEqualTo(removed);
            assertThat(regeneration.getCreatedInstances()).hasSize(4);
        }
    }

    @Nested
    @DisplayName("Retention Tests")
    class RetentionTests {

        @Test
        @DisplayName("Should only retire completed and skipped instances past the window")
        void shouldNeverRetirePending() {
            // Given
            when(instanceRepository.deleteResolvedBefore(eq(TODAY.minusDays(90)), anyCollection())).thenReturn(5);

            // When
            var retired = recurrenceService.retireStaleInstances(90);

            // Then
            assertThat(retired).isEqualTo(5);
            verify(instanceRepository).deleteResolvedBefore(eq(TODAY.minusDays(90)), statusesCaptor.capture());
            assertThat(statusesCaptor.getValue())
                    .containsExactlyInAnyOrder(InstanceStatus.COMPLETED, InstanceStatus.SKIPPED)
                    .doesNotContain(InstanceStatus.PENDING);
            verify(metricsConfig).recordRetired(5);
        }
    }
}
