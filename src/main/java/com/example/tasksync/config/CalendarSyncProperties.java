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

/**
 * Configuration properties for calendar synchronization, the API throttle
 * and the token lifecycle.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "calendar-sync")
public class CalendarSyncProperties {

    /**
     * Summary of the dedicated calendar created when sync is enabled
     */
    @NotBlank
    private String calendarName = "Task Sync";

    @Min(1)
    private int defaultDurationMinutes = 30;

    /**
     * Worker threads for fire-and-forget sync
     */
    @Min(1)
    private int executorPoolSize = 4;

    @Min(1)
    private int executorQueueCapacity = 1000;

    @Valid
    private Throttle throttle = new Throttle();

    @Valid
    private Token token = new Token();

    @Data
    public static class Throttle {

        /**
         * Delay applied after the first rate-limit response
         */
        @NotNull
        private Duration baseDelay = Duration.ofMillis(200);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        /**
         * Consecutive successes needed before the delay is halved
         */
        @Min(1)
        private int successesToDecrease = 10;

        /**
         * Retries of a single rate-limited call
         */
        @Min(0)
        private int maxRetries = 3;

        /**
         * First backoff before retrying a rate-limited call, doubled per retry
         */
        @NotNull
        private Duration backoffBase = Duration.ofSeconds(5);
    }

    @Data
    public static class Token {

        /**
         * A token expiring within this margin is refreshed
         */
        @NotNull
        private Duration expiryMargin = Duration.ofMinutes(5);

        /**
         * Lease held on the credential row while refreshing
         */
        @NotNull
        private Duration lockTtl = Duration.ofSeconds(30);

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(100);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(2);

        /**
         * How long a caller waits on another caller's refresh before refreshing itself
         */
        @NotNull
        private Duration waitTimeout = Duration.ofSeconds(10);
    }
}
