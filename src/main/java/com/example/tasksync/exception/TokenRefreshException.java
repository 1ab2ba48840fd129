package com.example.tasksync.exception;

import lombok.Getter;

/**
 * The Google credential of a user cannot be refreshed and needs the user to reconnect
 */
@Getter
public class TokenRefreshException extends RuntimeException {

    private final Long userId;

    public TokenRefreshException(Long userId, String message) {
        super(String.format("Token refresh failed for user %d: %s", userId, message));
        this.userId = userId;
    }

    public TokenRefreshException(Long userId, String message, Throwable cause) {
        super(String.format("Token refresh failed for user %d: %s", userId, message), cause);
        this.userId = userId;
    }
}
