package com.example.tasksync.integration;

import com.example.tasksync.TestcontainersConfiguration;
import com.example.tasksync.client.GoogleCalendarClient;
import com.example.tasksync.client.GoogleOAuthClient;
import com.example.tasksync.domain.entity.Task;
import com.example.tasksync.domain.entity.TaskInstance;
import com.example.tasksync.domain.enums.Frequency;
import com.example.tasksync.domain.enums.InstanceStatus;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.TaskInstanceInsertDao;
import com.example.tasksync.domain.repository.TaskInstanceRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import com.example.tasksync.dto.CreateTaskRequest;
import com.example.tasksync.dto.RecurrenceRuleDto;
import com.example.tasksync.dto.UpdateTaskRequest;
import com.example.tasksync.service.TaskService;
import com.example.tasksync.service.recurrence.RecurrenceService;
import com.example.tasksync.service.schedule.ScheduleQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "task-sync.maintenance.enabled=false",
        "slack.enabled=false"
})
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Task Sync Integration Tests")
class TaskSyncIntegrationTest {

    private static final long USER_ID = 1001L;

    @MockBean
    private GoogleCalendarClient googleCalendarClient;

    @MockBean
    private GoogleOAuthClient googleOAuthClient;

    @Autowired
    private TaskService taskService;

    @Autowired
    private RecurrenceService recurrenceService;

    @Autowired
    private ScheduleQueryService scheduleQueryService;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private TaskInstanceRepository instanceRepository;

    @Autowired
    private TaskInstanceInsertDao instanceInsertDao;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        instanceRepository.deleteAllInBatch();
        taskRepository.deleteAllInBatch();
    }

    private static LocalDate today() {
        return LocalDate.now(ZoneOffset.UTC);
    }

    private Task createDailyTask() {
        var response = taskService.createTask(USER_ID, CreateTaskRequest.builder()
                .title("Water plants")
                .scheduledTime(LocalTime.of(8, 0))
                .recurring(true)
                .recurrenceRule(RecurrenceRuleDto.builder().frequency(Frequency.DAILY).build())
                .build());
        return taskRepository.findById(response.getId()).orElseThrow();
    }

    private TaskInstance instance(UUID taskId, LocalDate date, InstanceStatus status) {
        return TaskInstance.builder()
                .id(UUID.randomUUID())
                .taskId(taskId)
                .userId(USER_ID)
                .occurrenceDate(date)
                .status(status)
                .build();
    }

    @Nested
    @DisplayName("Materialization")
    class MaterializationTests {

        @Test
        @DisplayName("Should materialize the horizon once and stay idempotent")
        void shouldMaterializeIdempotently() {
            // Given
            var task = createDailyTask();
            var initial = instanceRepository.findIdsByTaskId(task.getId()).size();

            // When
            var again = recurrenceService.materialize(task);

            // Then
            assertThat(initial).isEqualTo(60);
            assertThat(again).isEmpty();
            assertThat(instanceRepository.findIdsByTaskId(task.getId())).hasSize(60);
        }

        @Test
        @DisplayName("The unique key rejects a second instance for the same date without aborting the transaction")
        void shouldRejectDuplicateDate() {
            // Given
            var task = createDailyTask();
            var date = today();

            // When
            var results = transactionTemplate.execute(status -> new boolean[]{
                    instanceInsertDao.insertIfAbsent(instance(task.getId(), date, InstanceStatus.PENDING)),
                    instanceInsertDao.insertIfAbsent(instance(task.getId(), date.minusDays(1), InstanceStatus.PENDING))
            });

            // Then
            assertThat(results).containsExactly(false, true);
            assertThat(instanceRepository.findOccurrenceDates(task.getId(), date.minusDays(1), date))
                    .containsExactlyInAnyOrder(date.minusDays(1), date);
        }
    }

    @Nested
    @DisplayName("Retention")
    class RetentionTests {

        @Test
        @DisplayName("Should delete old resolved instances and keep old pending ones")
        void shouldKeepPendingInstances() {
            // Given
            var task = createDailyTask();
            var old = today().minusDays(200);
            var completed = instance(task.getId(), old, InstanceStatus.COMPLETED);
            var pending = instance(task.getId(), old.plusDays(1), InstanceStatus.PENDING);
            transactionTemplate.executeWithoutResult(status -> {
                instanceInsertDao.insertIfAbsent(completed);
                instanceInsertDao.insertIfAbsent(pending);
            });

            // When
            var retired = recurrenceService.retireStaleInstances(90);

            // Then
            assertThat(retired).isEqualTo(1);
            assertThat(instanceRepository.findById(completed.getId())).isEmpty();
            assertThat(instanceRepository.findById(pending.getId())).isPresent();
        }
    }

    @Nested
    @DisplayName("Schedule Query")
    class ScheduleQueryTests {

        @Test
        @DisplayName("Archiving a series hides its instances without deleting them")
        void shouldHideArchivedSeries() {
            // Given
            var task = createDailyTask();
            var from = today();
            var to = from.plusDays(2);
            assertThat(scheduleQueryService.getSchedulableUnits(USER_ID, from, to))
                    .allMatch(day -> day.getUnits().size() == 1);

            // When
            taskService.updateTask(USER_ID, task.getId(), UpdateTaskRequest.builder().status(TaskStatus.ARCHIVED).build());

            // Then
            var days = scheduleQueryService.getSchedulableUnits(USER_ID, from, to);
            assertThat(days).hasSize(3).allMatch(day -> day.getUnits().isEmpty());
            assertThat(instanceRepository.findIdsByTaskId(task.getId())).hasSize(60);
        }
    }
}
