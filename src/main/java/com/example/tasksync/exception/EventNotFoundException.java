package com.example.tasksync.exception;

/**
 * A single calendar event no longer exists (404/410)
 */
public class EventNotFoundException extends ExternalServiceException {

    public EventNotFoundException(String serviceName, int httpStatusCode, String responseBody) {
        super(serviceName, httpStatusCode, responseBody, false);
    }
}
