package com.example.tasksync.config;

import com.example.tasksync.service.calendar.AdaptiveThrottle;
import com.example.tasksync.service.calendar.Sleeper;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared calendar API collaborators.
 */
@Configuration
public class CalendarSyncConfig {

    /**
     * The one throttle every calendar API caller in this process goes through
     */
    @Bean
    public AdaptiveThrottle calendarApiThrottle(CalendarSyncProperties properties, MeterRegistry meterRegistry,
                                                Sleeper sleeper) {
        var throttle = new AdaptiveThrottle(properties.getThrottle(), sleeper);
        Gauge.builder("calendar.sync.throttle.delay.ms", throttle, AdaptiveThrottle::getCurrentDelayMillis)
                .description("Current delay applied before each calendar API call")
                .register(meterRegistry);
        return throttle;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }
}
