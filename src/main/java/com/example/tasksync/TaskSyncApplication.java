package com.example.tasksync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Task Calendar Sync Application
 * <p>
 * Materializes recurring tasks into dated instances over a rolling horizon
 * and mirrors every schedulable unit into a dedicated Google Calendar.
 * <p>
 * Features:
 * - RFC-5545 recurrence expansion with idempotent, race-safe materialization
 * - Fire-and-forget sync after every local mutation
 * - Periodic reconciliation sweep that heals drift and removes orphaned events
 * - Adaptive throttling of the calendar API and single-flight token refresh
 */
@EnableScheduling
@SpringBootApplication
public class TaskSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskSyncApplication.class, args);
    }
}
