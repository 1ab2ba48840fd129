package com.example.tasksync.client;

import com.example.tasksync.client.ClientModels.TokenResponse;
import com.example.tasksync.config.GoogleApiProperties;
import com.example.tasksync.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the Google OAuth 2.0 token endpoint.
 * <p>
 * A 4xx answer other than 408/429 means the refresh token was revoked or is
 * invalid; it is reported as a non-retryable {@link ExternalServiceException}.
 */
@Slf4j
@Component
public class GoogleOAuthClient {

    static final String SERVICE_NAME = "Google OAuth";

    private final WebClient webClient;
    private final GoogleApiProperties properties;

    public GoogleOAuthClient(@Qualifier("googleOAuthWebClient") WebClient webClient, GoogleApiProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @CircuitBreaker(name = "googleOAuth")
    @Retry(name = "googleOAuth")
    public TokenResponse refreshAccessToken(String refreshToken) {
        log.debug("Refreshing Google access token");
        try {
            return webClient.post()
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData("grant_type", "refresh_token")
                            .with("refresh_token", refreshToken)
                            .with("client_id", nullToEmpty(properties.getClientId()))
                            .with("client_secret", nullToEmpty(properties.getClientSecret())))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(TokenResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Token refresh call failed: {}", e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
