package com.example.tasksync.exception;

/**
 * The calendar API asked us to slow down (429, or 403 in the usageLimits domain).
 * Handled by the adaptive throttle, never by the generic retry.
 */
public class RateLimitException extends ExternalServiceException {

    public RateLimitException(String serviceName, int httpStatusCode, String responseBody) {
        super(serviceName, httpStatusCode, responseBody, true);
    }
}
