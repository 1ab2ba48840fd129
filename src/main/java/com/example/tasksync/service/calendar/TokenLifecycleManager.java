package com.example.tasksync.service.calendar;

import com.example.tasksync.client.ClientModels.TokenResponse;
import com.example.tasksync.client.GoogleOAuthClient;
import com.example.tasksync.config.CalendarSyncProperties;
import com.example.tasksync.config.MetricsConfig;
import com.example.tasksync.domain.entity.GoogleToken;
import com.example.tasksync.domain.repository.GoogleTokenRepository;
import com.example.tasksync.exception.ExternalServiceException;
import com.example.tasksync.exception.TokenRefreshException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Keeps each user's Google access token valid without stampeding the token endpoint.
 * <p>
 * Flow when the token is expired or about to expire:
 * 1. Try to take the refresh lease on the credential row (non-blocking CAS update)
 * 2. The winner re-reads the row, refreshes if still needed, stores the result and releases the lease
 * 3. Everyone else backs off exponentially and re-reads the row until a valid token shows up
 * 4. A caller still waiting after the wait timeout refreshes on its own
 */
@Slf4j
@Service
public class TokenLifecycleManager {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final GoogleTokenRepository tokenRepository;
    private final GoogleOAuthClient oauthClient;
    private final CalendarSyncProperties.Token settings;
    private final MetricsConfig metricsConfig;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String instanceId = ManagementFactory.getRuntimeMXBean().getName();

    public TokenLifecycleManager(GoogleTokenRepository tokenRepository, GoogleOAuthClient oauthClient,
                                 CalendarSyncProperties properties, MetricsConfig metricsConfig,
                                 Sleeper sleeper, Clock clock) {
        this.tokenRepository = tokenRepository;
        this.oauthClient = oauthClient;
        this.settings = properties.getToken();
        this.metricsConfig = metricsConfig;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Return a usable access token for the user, refreshing it if needed.
     *
     * @throws TokenRefreshException if the user has no credential or it cannot be refreshed
     */
    public String ensureValidToken(long userId) {
        var token = loadToken(userId);
        if (isValid(token)) {
            return token.getAccessToken();
        }

        var deadline = clock.instant().plus(settings.getWaitTimeout());
        var backoff = settings.getInitialBackoff();
        while (true) {
            var owner = instanceId + ":" + UUID.randomUUID();
            var now = clock.instant();
            if (tokenRepository.tryAcquireRefreshLock(userId, owner, now.plus(settings.getLockTtl()), now) == 1) {
                try {
                    var current = loadToken(userId);
                    if (isValid(current)) {
                        log.debug("Token for user {} was refreshed before the lease was taken", userId);
                        return current.getAccessToken();
                    }
                    return refresh(current, false);
                } finally {
                    tokenRepository.releaseRefreshLock(userId, owner);
                }
            }

            log.debug("Token refresh for user {} in progress elsewhere, waiting {}ms", userId, backoff.toMillis());
            pause(userId, backoff);
            backoff = min(backoff.multipliedBy(2), settings.getMaxBackoff());

            token = loadToken(userId);
            if (isValid(token)) {
                return token.getAccessToken();
            }
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Gave up waiting on token refresh lease for user {}, refreshing directly", userId);
                return refresh(token, true);
            }
        }
    }

    /**
     * Discard the rejected access token and obtain a new one. Used after the
     * calendar API rejected a token that looked valid. If another caller already
     * replaced the rejected token, its replacement is returned as is.
     */
    public String forceRefresh(long userId, String rejectedAccessToken) {
        if (tokenRepository.expireAccessToken(userId, rejectedAccessToken, clock.instant()) == 0) {
            log.debug("Rejected token for user {} already replaced, skipping forced refresh", userId);
        }
        return ensureValidToken(userId);
    }

    private String refresh(GoogleToken token, boolean forced) {
        var userId = token.getUserId();
        if (token.getRefreshToken() == null || token.getRefreshToken().isBlank()) {
            throw new TokenRefreshException(userId, "no refresh token stored");
        }

        TokenResponse response;
        try {
            response = oauthClient.refreshAccessToken(token.getRefreshToken());
        } catch (ExternalServiceException e) {
            if (!e.isRetryable()) {
                throw new TokenRefreshException(userId, "refresh token rejected", e);
            }
            throw e;
        }
        if (response == null || response.getAccessToken() == null) {
            throw new TokenRefreshException(userId, "token endpoint returned no access token");
        }

        var now = clock.instant();
        var expiresIn = response.getExpiresIn() != null ? response.getExpiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
        var expiresAt = now.plusSeconds(expiresIn);
        tokenRepository.updateTokens(userId, response.getAccessToken(), response.getRefreshToken(), expiresAt, now);
        metricsConfig.recordTokenRefresh(forced);
        log.info("Refreshed Google token for user {}, valid until {}", userId, expiresAt);
        return response.getAccessToken();
    }

    private GoogleToken loadToken(long userId) {
        return tokenRepository.findByUserId(userId)
                .orElseThrow(() -> new TokenRefreshException(userId, "no Google credential stored"));
    }

    private boolean isValid(GoogleToken token) {
        return token.isValidAt(clock.instant(), settings.getExpiryMargin());
    }

    private void pause(long userId, Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenRefreshException(userId, "interrupted while waiting for refresh", e);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
