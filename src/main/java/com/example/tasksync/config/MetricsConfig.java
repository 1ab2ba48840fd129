package com.example.tasksync.config;

import com.example.tasksync.domain.enums.InstanceStatus;
import com.example.tasksync.domain.enums.SyncOutcome;
import com.example.tasksync.domain.repository.CalendarEventSyncRepository;
import com.example.tasksync.domain.repository.CalendarSyncSettingsRepository;
import com.example.tasksync.domain.repository.TaskInstanceRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for materialization and calendar sync.
 * <p>
 * Exposes Prometheus metrics for:
 * - Instance counts by status
 * - Sync records and users with sync enabled
 * - Sync outcomes and failure reasons
 * - Sweep durations and token refreshes
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final TaskInstanceRepository instanceRepository;
    private final CalendarEventSyncRepository syncRepository;
    private final CalendarSyncSettingsRepository settingsRepository;

    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : InstanceStatus.values()) {
            var key = "instances_" + status.getCode();
            gauges.put(key, new AtomicLong(0));

            Gauge.builder("recurrence.instances", gauges.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of materialized instances by status")
                    .register(meterRegistry);
        }

        gauges.put("sync_records", new AtomicLong(0));
        Gauge.builder("calendar.sync.records", gauges.get("sync_records"), AtomicLong::get)
                .description("Number of units mirrored to a calendar")
                .register(meterRegistry);

        gauges.put("sync_users", new AtomicLong(0));
        Gauge.builder("calendar.sync.users", gauges.get("sync_users"), AtomicLong::get)
                .description("Number of users with calendar sync enabled")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${task-sync.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        for (var status : InstanceStatus.values()) {
            gauges.get("instances_" + status.getCode()).set(instanceRepository.countByStatus(status));
        }
        gauges.get("sync_records").set(syncRepository.count());
        gauges.get("sync_users").set(settingsRepository.countBySyncEnabledTrue());
    }

    public void recordSyncOutcome(SyncOutcome outcome) {
        meterRegistry.counter("calendar.sync.operations", "outcome", outcome.name().toLowerCase()).increment();
    }

    public void recordSyncFailure(String reason) {
        meterRegistry.counter("calendar.sync.failures", "reason", reason != null ? reason : "unknown").increment();
    }

    public void recordMaterialized(int count) {
        meterRegistry.counter("recurrence.instances.materialized").increment(count);
    }

    public void recordRetired(int count) {
        meterRegistry.counter("recurrence.instances.retired").increment(count);
    }

    public void recordTokenRefresh(boolean forced) {
        meterRegistry.counter("calendar.token.refreshes", "forced", String.valueOf(forced)).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordSweep(Timer.Sample sample, boolean cancelled) {
        sample.stop(Timer.builder("calendar.sync.sweep.duration")
                .tag("cancelled", String.valueOf(cancelled))
                .description("Reconciliation sweep duration per user")
                .register(meterRegistry));
    }
}
