package com.example.tasksync.service.maintenance;

import com.example.tasksync.config.TaskSyncProperties;
import com.example.tasksync.domain.entity.CalendarSyncSettings;
import com.example.tasksync.domain.enums.TaskStatus;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.domain.repository.TaskRepository;
import com.example.tasksync.dto.SyncStats;
import com.example.tasksync.service.alert.SlackAlertService;
import com.example.tasksync.service.recurrence.RecurrenceService;
import com.example.tasksync.service.sync.ReconciliationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MaintenanceScheduler Tests")
class MaintenanceSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private CalendarSyncSettingsRepository settingsRepository;

    @Mock
    private RecurrenceService recurrenceService;

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private Clock clock;

    private TaskSyncProperties properties;
    private ExecutorService executor;
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new TaskSyncProperties();
        executor = Executors.newCachedThreadPool();
        scheduler = new MaintenanceScheduler(taskRepository, settingsRepository, recurrenceService,
                reconciliationService, slackAlertService, properties, executor, clock);
        lenient().when(clock.instant()).thenReturn(NOW);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static CalendarSyncSettings activeSettings(long userId) {
        return CalendarSyncSettings.builder().userId(userId).syncEnabled(true).calendarId("cal").build();
    }

    @Nested
    @DisplayName("Cycle Tests")
    class CycleTests {

        @Test
        @DisplayName("Should process every relevant user once, in id order")
        void shouldProcessUnionOfUsers() {
            // Given
            when(taskRepository.findUserIdsWithRecurringStatus(TaskStatus.PENDING)).thenReturn(List.of(3L, 1L));
            when(settingsRepository.findUserIdsWithSyncEnabled()).thenReturn(List.of(2L, 1L));
            when(settingsRepository.findByUserId(anyLong())).thenReturn(Optional.empty());
            when(settingsRepository.findByUserId(2L)).thenReturn(Optional.of(activeSettings(2L)));
            when(recurrenceService.ensureMaterialized(anyLong())).thenReturn(List.of());
            when(reconciliationService.reconcile(eq(2L), any(BooleanSupplier.class))).thenReturn(new SyncStats());

            // When
            scheduler.runMaintenanceCycle();

            // Then
            var inOrder = inOrder(recurrenceService);
            inOrder.verify(recurrenceService).ensureMaterialized(1L);
            inOrder.verify(recurrenceService).ensureMaterialized(2L);
            inOrder.verify(recurrenceService).ensureMaterialized(3L);
            verify(reconciliationService, times(1)).reconcile(anyLong(), any(BooleanSupplier.class));
        }

        @Test
        @DisplayName("Should do nothing when maintenance is disabled")
        void shouldSkipWhenDisabled() {
            properties.getMaintenance().setEnabled(false);

            scheduler.runMaintenanceCycle();

            verifyNoInteractions(taskRepository, settingsRepository, recurrenceService, reconciliationService);
        }

        @Test
        @DisplayName("A failing user does not stop the cycle")
        void shouldContinueAfterUserFailure() {
            // Given
            when(taskRepository.findUserIdsWithRecurringStatus(TaskStatus.PENDING)).thenReturn(List.of(1L, 2L));
            when(settingsRepository.findUserIdsWithSyncEnabled()).thenReturn(List.of());
            when(recurrenceService.ensureMaterialized(1L)).thenThrow(new IllegalStateException("db down"));
            when(recurrenceService.ensureMaterialized(2L)).thenReturn(List.of());
            when(settingsRepository.findByUserId(2L)).thenReturn(Optional.empty());

            // When
            scheduler.runMaintenanceCycle();

            // Then
            verify(recurrenceService).ensureMaterialized(2L);
        }

        @Test
        @DisplayName("Users left when the cycle budget is spent wait for the next cycle")
        void shouldStopAtCycleDeadline() {
            // Given
            when(clock.instant()).thenReturn(NOW, NOW, NOW.plus(Duration.ofHours(2)));
            when(taskRepository.findUserIdsWithRecurringStatus(TaskStatus.PENDING)).thenReturn(List.of(1L, 2L));
            when(settingsRepository.findUserIdsWithSyncEnabled()).thenReturn(List.of());
            when(recurrenceService.ensureMaterialized(1L)).thenReturn(List.of());
            when(settingsRepository.findByUserId(1L)).thenReturn(Optional.empty());

            // When
            scheduler.runMaintenanceCycle();

            // Then
            verify(recurrenceService).ensureMaterialized(1L);
            verify(recurrenceService, never()).ensureMaterialized(2L);
            verify(slackAlertService).sendErrorAlert(eq("Maintenance cycle over budget"), contains("1 of 2"), isNull());
        }

        @Test
        @DisplayName("Should alert when the user listing fails")
        void shouldAlertOnCycleFailure() {
            // Given
            when(taskRepository.findUserIdsWithRecurringStatus(TaskStatus.PENDING))
                    .thenThrow(new IllegalStateException("db down"));

            // When
            scheduler.runMaintenanceCycle();

            // Then
            verify(slackAlertService).sendErrorAlert(eq("Maintenance cycle failed"), eq("db down"), anyString());
            verifyNoInteractions(recurrenceService);
        }
    }

    @Nested
    @DisplayName("User Budget Tests")
    class UserBudgetTests {

        @Test
        @DisplayName("A user over budget is cancelled and its sweep sees the cancellation")
        void shouldCancelSlowUser() throws Exception {
            // Given
            properties.getMaintenance().setUserTimeout(Duration.ofMillis(300));
            var sawCancellation = new CountDownLatch(1);
            when(recurrenceService.ensureMaterialized(7L)).thenReturn(List.of());
            lenient().when(settingsRepository.findByUserId(7L)).thenReturn(Optional.of(activeSettings(7L)));
            lenient().when(reconciliationService.reconcile(eq(7L), any(BooleanSupplier.class))).thenAnswer(inv -> {
                BooleanSupplier cancelled = inv.getArgument(1);
                var giveUpAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (!cancelled.getAsBoolean() && System.nanoTime() < giveUpAt) {
                    Thread.sleep(10);
                }
                if (cancelled.getAsBoolean()) {
                    sawCancellation.countDown();
                }
                var stats = new SyncStats();
                stats.setCancelled(true);
                return stats;
            });

            // When
            var finished = scheduler.processUser(7L);

            // Then
            assertThat(finished).isFalse();
            assertThat(sawCancellation.await(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("A user within budget reports the sweep result")
        void shouldReportSweepResult() throws Exception {
            when(recurrenceService.ensureMaterialized(7L)).thenReturn(List.of());
            when(settingsRepository.findByUserId(7L)).thenReturn(Optional.of(activeSettings(7L)));
            when(reconciliationService.reconcile(eq(7L), any(BooleanSupplier.class))).thenReturn(new SyncStats());

            assertThat(scheduler.processUser(7L)).isTrue();
        }
    }

    @Test
    @DisplayName("Retention uses the configured window")
    void shouldRetireWithConfiguredWindow() {
        properties.getRecurrence().setRetentionDays(30);
        when(recurrenceService.retireStaleInstances(30)).thenReturn(4);

        scheduler.retireStaleInstances();

        verify(recurrenceService).retireStaleInstances(30);
    }
}
