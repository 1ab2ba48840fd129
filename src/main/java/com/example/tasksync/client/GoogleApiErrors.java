package com.example.tasksync.client;

import com.example.tasksync.exception.CalendarAccessException;
import com.example.tasksync.exception.CalendarAuthException;
import com.example.tasksync.exception.EventNotFoundException;
import com.example.tasksync.exception.ExternalServiceException;
import com.example.tasksync.exception.RateLimitException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Maps Google API error responses onto the exception taxonomy.
 */
@Slf4j
public final class GoogleApiErrors {

    static final String SERVICE_NAME = "Google Calendar";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded", "quotaExceeded");

    private GoogleApiErrors() {
    }

    /**
     * Target of the failed request: the calendar as a whole, or one event in it
     */
    public enum Scope {
        CALENDAR,
        EVENT
    }

    public static ExternalServiceException toException(int status, String body, Scope scope) {
        if (status == 429 || (status == 403 && isRateLimit(body))) {
            return new RateLimitException(SERVICE_NAME, status, body);
        }
        if (status == 401) {
            return new CalendarAuthException(SERVICE_NAME, body);
        }
        if (status == 403) {
            return new CalendarAccessException(SERVICE_NAME, status, body);
        }
        if (status == 404 || status == 410) {
            return scope == Scope.EVENT
                    ? new EventNotFoundException(SERVICE_NAME, status, body)
                    : new CalendarAccessException(SERVICE_NAME, status, body);
        }
        return new ExternalServiceException(SERVICE_NAME, status, body);
    }

    /**
     * Google reports quota errors as 403 with an error domain of "usageLimits"
     */
    static boolean isRateLimit(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            var errors = MAPPER.readTree(body).path("error").path("errors");
            for (JsonNode error : errors) {
                if ("usageLimits".equals(error.path("domain").asText())
                        || RATE_LIMIT_REASONS.contains(error.path("reason").asText())) {
                    return true;
                }
            }
            return false;
        } catch (Exception e) {
            log.debug("Unparseable Google error body: {}", e.getMessage());
            return body.contains("usageLimits") || body.contains("rateLimitExceeded");
        }
    }
}
