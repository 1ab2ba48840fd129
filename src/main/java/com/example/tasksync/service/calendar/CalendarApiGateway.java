package com.example.tasksync.service.calendar;

import com.example.tasksync.exception.CalendarAuthException;
import com.example.tasksync.exception.TokenRefreshException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Single entry point for calendar API calls made on behalf of a user.
 * <p>
 * Supplies a valid access token and routes the call through the shared
 * throttle. A 401 triggers one forced token refresh and a single retry; a
 * second 401 means the credential is unusable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarApiGateway {

    private final TokenLifecycleManager tokenManager;
    private final AdaptiveThrottle throttle;

    public <T> T call(long userId, String operation, Function<String, T> apiCall) {
        var accessToken = tokenManager.ensureValidToken(userId);
        try {
            return throttle.execute(operation, () -> apiCall.apply(accessToken));
        } catch (CalendarAuthException e) {
            log.warn("Access token for user {} rejected on {}, forcing refresh", userId, operation);
            var refreshed = tokenManager.forceRefresh(userId, accessToken);
            try {
                return throttle.execute(operation, () -> apiCall.apply(refreshed));
            } catch (CalendarAuthException again) {
                throw new TokenRefreshException(userId, "calendar API rejected a freshly refreshed token", again);
            }
        }
    }
}
