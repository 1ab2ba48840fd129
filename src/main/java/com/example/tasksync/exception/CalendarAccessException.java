package com.example.tasksync.exception;

import lombok.Getter;

/**
 * Write access to the sync calendar is gone: a 403 that is not a rate limit,
 * or the calendar itself returned 404/410.
 */
@Getter
public class CalendarAccessException extends ExternalServiceException {

    private final boolean calendarDeleted;

    public CalendarAccessException(String serviceName, int httpStatusCode, String responseBody) {
        super(serviceName, httpStatusCode, responseBody, false);
        this.calendarDeleted = httpStatusCode == 404 || httpStatusCode == 410;
    }
}
