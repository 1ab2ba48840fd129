package com.example.tasksync.client;

import com.example.tasksync.client.GoogleApiErrors.Scope;
import com.example.tasksync.exception.CalendarAccessException;
import com.example.tasksync.exception.CalendarAuthException;
import com.example.tasksync.exception.EventNotFoundException;
import com.example.tasksync.exception.ExternalServiceException;
import com.example.tasksync.exception.RateLimitException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GoogleApiErrors Tests")
class GoogleApiErrorsTest {

    private static final String USAGE_LIMITS_BODY = """
            {"error":{"code":403,"errors":[{"domain":"usageLimits","reason":"rateLimitExceeded"}]}}
            """;

    private static final String FORBIDDEN_BODY = """
            {"error":{"code":403,"errors":[{"domain":"global","reason":"forbidden"}]}}
            """;

    @Test
    @DisplayName("429 and usage-limit 403 are rate limits")
    void shouldClassifyRateLimits() {
        assertThat(GoogleApiErrors.toException(429, "", Scope.EVENT)).isInstanceOf(RateLimitException.class);
        assertThat(GoogleApiErrors.toException(403, USAGE_LIMITS_BODY, Scope.EVENT)).isInstanceOf(RateLimitException.class);
    }

    @Test
    @DisplayName("Any other 403 means calendar access is gone")
    void shouldClassifyForbiddenAsAccessLoss() {
        var error = GoogleApiErrors.toException(403, FORBIDDEN_BODY, Scope.EVENT);

        assertThat(error).isInstanceOf(CalendarAccessException.class);
        assertThat(((CalendarAccessException) error).isCalendarDeleted()).isFalse();
        assertThat(error.isRetryable()).isFalse();
    }

    @Test
    @DisplayName("401 is an authentication failure")
    void shouldClassifyUnauthorized() {
        assertThat(GoogleApiErrors.toException(401, "", Scope.CALENDAR)).isInstanceOf(CalendarAuthException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {404, 410})
    @DisplayName("Missing event vs. missing calendar depends on the request target")
    void shouldClassifyNotFoundByScope(int status) {
        var eventError = GoogleApiErrors.toException(status, "", Scope.EVENT);
        var calendarError = GoogleApiErrors.toException(status, "", Scope.CALENDAR);

        assertThat(eventError).isInstanceOf(EventNotFoundException.class);
        assertThat(calendarError).isInstanceOf(CalendarAccessException.class);
        assertThat(((CalendarAccessException) calendarError).isCalendarDeleted()).isTrue();
    }

    @Test
    @DisplayName("Server errors stay generic and retryable")
    void shouldKeepServerErrorsRetryable() {
        var error = GoogleApiErrors.toException(503, "unavailable", Scope.EVENT);

        assertThat(error.getClass()).isEqualTo(ExternalServiceException.class);
        assertThat(error.isRetryable()).isTrue();
        assertThat(error.getHttpStatusCode()).isEqualTo(503);
    }

    @Test
    @DisplayName("Unparseable bodies fall back to a text search")
    void shouldFallBackOnUnparseableBody() {
        assertThat(GoogleApiErrors.isRateLimit("<html>usageLimits</html>")).isTrue();
        assertThat(GoogleApiErrors.isRateLimit("<html>denied</html>")).isFalse();
        assertThat(GoogleApiErrors.isRateLimit(null)).isFalse();
    }
}
