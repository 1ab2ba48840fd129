package com.example.tasksync.exception;

/**
 * The calendar API rejected the access token (HTTP 401)
 */
public class CalendarAuthException extends ExternalServiceException {

    public CalendarAuthException(String serviceName, String responseBody) {
        super(serviceName, 401, responseBody, false);
    }
}
