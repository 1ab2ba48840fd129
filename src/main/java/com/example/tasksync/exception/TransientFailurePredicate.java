package com.example.tasksync.exception;

import java.util.function.Predicate;

/**
 * Resilience4j predicate selecting failures worth retrying or counting against
 * a circuit breaker: network errors and retryable HTTP statuses. Rate limits are
 * left to the adaptive throttle.
 */
public class TransientFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof RateLimitException) {
            return false;
        }
        if (throwable instanceof ExternalServiceException e) {
            return e.isRetryable();
        }
        return false;
    }
}
