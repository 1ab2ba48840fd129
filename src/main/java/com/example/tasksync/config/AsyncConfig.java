package com.example.tasksync.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for async processing.
 * <p>
 * Fire-and-forget sync runs on a bounded pool so a burst of edits queues up
 * instead of opening unbounded connections to the calendar API. The maintenance
 * loop gets its own small pool so a user's cycle can be abandoned on timeout
 * without blocking the scheduler thread.
 */
@Slf4j
@EnableAsync
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final CalendarSyncProperties calendarSyncProperties;

    /**
     * Executor for fire-and-forget calendar sync triggered after local mutations.
     */
    @Bean(name = "syncExecutor")
    public TaskExecutor syncExecutor() {
        var poolSize = calendarSyncProperties.getExecutorPoolSize();
        log.info("Configuring calendar sync executor with {} threads", poolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(calendarSyncProperties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("calendar-sync-");
        executor.setRejectedExecutionHandler((r, e) -> {
            // dropped work is picked up by the next reconciliation sweep
            log.warn("Sync queue full, dropping fire-and-forget sync");
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }

    /**
     * Executor for Spring's default @Async usage (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.initialize();

        return executor;
    }

    /**
     * Executor running one user's maintenance cycle at a time.
     */
    @Bean(name = "maintenanceExecutor", destroyMethod = "shutdownNow")
    public ExecutorService maintenanceExecutor() {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, runnable -> {
            var thread = new Thread(runnable, "maintenance-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }
}
