package com.example.tasksync.service.calendar;

import com.example.tasksync.config.CalendarSyncProperties;
import com.example.tasksync.exception.ExternalServiceException;
import com.example.tasksync.exception.RateLimitException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Shared rate governor in front of the calendar API.
 * <p>
 * Every call waits the current delay first. A rate-limit response doubles the
 * delay (starting from the base delay, capped at the maximum) and the call is
 * retried after an exponential backoff. After a run of consecutive successes
 * the delay is halved, dropping to zero once it falls under the base delay.
 * <p>
 * One instance is shared by the fire-and-forget path and the sweep, so a noisy
 * sweep slows every caller down. State is guarded by this object's monitor.
 */
@Slf4j
public class AdaptiveThrottle {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int successesToDecrease;
    private final int maxRetries;
    private final Duration backoffBase;
    private final Sleeper sleeper;

    private long delayMs;
    private int consecutiveSuccesses;
    private int consecutiveFailures;

    public AdaptiveThrottle(CalendarSyncProperties.Throttle settings, Sleeper sleeper) {
        if (settings.getBaseDelay().compareTo(settings.getMaxDelay()) > 0) {
            throw new IllegalArgumentException("Throttle base delay must not exceed max delay");
        }
        this.baseDelayMs = settings.getBaseDelay().toMillis();
        this.maxDelayMs = settings.getMaxDelay().toMillis();
        this.successesToDecrease = settings.getSuccessesToDecrease();
        this.maxRetries = settings.getMaxRetries();
        this.backoffBase = settings.getBackoffBase();
        this.sleeper = sleeper;
    }

    /**
     * Run one API call through the throttle, retrying it on rate-limit responses.
     *
     * @throws RateLimitException if the call is still rate limited after the configured retries
     */
    public <T> T execute(String operation, Supplier<T> call) {
        var attempt = 0;
        while (true) {
            pause(Duration.ofMillis(getCurrentDelayMillis()));
            try {
                var result = call.get();
                recordSuccess();
                return result;
            } catch (RateLimitException e) {
                recordRateLimit();
                attempt++;
                if (attempt > maxRetries) {
                    log.warn("Rate limited on {} after {} retries, giving up", operation, maxRetries);
                    throw e;
                }
                var backoff = backoffBase.multipliedBy(1L << (attempt - 1));
                log.warn("Rate limited on {} (retry {}/{}), backing off {}ms, throttle delay now {}ms",
                        operation, attempt, maxRetries, backoff.toMillis(), getCurrentDelayMillis());
                pause(backoff);
            }
        }
    }

    public synchronized void recordRateLimit() {
        consecutiveSuccesses = 0;
        consecutiveFailures++;
        var next = delayMs == 0 ? baseDelayMs : delayMs * 2;
        delayMs = Math.min(Math.max(next, delayMs), maxDelayMs);
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        if (delayMs == 0) {
            consecutiveSuccesses = 0;
            return;
        }
        consecutiveSuccesses++;
        if (consecutiveSuccesses >= successesToDecrease) {
            var next = delayMs / 2;
            delayMs = next < baseDelayMs ? 0 : next;
            consecutiveSuccesses = 0;
            log.debug("Throttle delay decreased to {}ms", delayMs);
        }
    }

    public synchronized long getCurrentDelayMillis() {
        return delayMs;
    }

    public synchronized int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    private void pause(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Google Calendar", "Interrupted while throttled", e);
        }
    }
}
