package com.example.tasksync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for recurrence materialization and the maintenance loop.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "task-sync")
public class TaskSyncProperties {

    @Valid
    private Recurrence recurrence = new Recurrence();

    @Valid
    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Recurrence {

        /**
         * Number of days ahead of today that instances are kept materialized
         */
        @Min(1)
        private int horizonDays = 60;

        /**
         * Completed and skipped instances older than this are deleted
         */
        @Min(1)
        private int retentionDays = 90;

        /**
         * A task is topped up once its latest instance falls within this many days of the horizon end
         */
        @Min(0)
        private int refreshThresholdDays = 7;

        /**
         * Zone used to turn an occurrence date and time-of-day into an instant.
         * Fixed for every user.
         */
        @NotBlank
        private String referenceTimezone = "UTC";

        public ZoneId getReferenceZone() {
            return ZoneId.of(referenceTimezone);
        }
    }

    @Data
    public static class Maintenance {

        private boolean enabled = true;

        /**
         * Delay between two maintenance cycles
         */
        @NotNull
        private Duration interval = Duration.ofHours(1);

        @NotNull
        private Duration initialDelay = Duration.ofMinutes(1);

        /**
         * Budget for one user's materialization plus reconciliation
         */
        @NotNull
        private Duration userTimeout = Duration.ofMinutes(5);

        /**
         * Budget for a whole cycle over every user
         */
        @NotNull
        private Duration cycleTimeout = Duration.ofMinutes(50);

        @NotBlank
        private String retentionCron = "0 30 3 * * *";
    }
}
