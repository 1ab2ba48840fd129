package com.example.tasksync.exception;

import lombok.Getter;

/**
 * Failure talking to a Google endpoint, either at the transport level or as an
 * HTTP error response. Subclasses narrow the HTTP cases the sync layer reacts to.
 * <p>
 * {@link #isRetryable()} drives the Resilience4j retry and circuit breaker
 * through {@link TransientFailurePredicate}.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;

    /**
     * Null for transport failures that never produced a response
     */
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;

    /**
     * Transport failure (connect, timeout, reset). Always retryable.
     */
    public ExternalServiceException(String serviceName, Exception cause) {
        this(serviceName, cause.getMessage(), cause);
    }

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        this(serviceName, httpStatusCode, responseBody, isTransientStatus(httpStatusCode));
    }

    protected ExternalServiceException(String serviceName, int httpStatusCode, String responseBody, boolean retryable) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        this.retryable = retryable;
    }

    /**
     * Server errors and request timeouts. 429 is transient too, but reaches the
     * adaptive throttle as a {@link RateLimitException} instead.
     */
    public static boolean isTransientStatus(int httpStatusCode) {
        return httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
