package com.example.tasksync.client;

import com.example.tasksync.client.ClientModels.CalendarEntry;
import com.example.tasksync.client.ClientModels.CalendarList;
import com.example.tasksync.client.ClientModels.EventList;
import com.example.tasksync.client.ClientModels.GoogleEvent;
import com.example.tasksync.client.GoogleApiErrors.Scope;
import com.example.tasksync.exception.EventNotFoundException;
import com.example.tasksync.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the Google Calendar v3 REST API.
 * <p>
 * Uses:
 * - Resilience4j retry and circuit breaker for network errors and 5xx
 * - WebClient, blocking on the caller's worker thread
 * <p>
 * Rate-limit, auth and not-found responses surface as typed exceptions for the
 * throttle and the token lifecycle manager to act on.
 */
@Slf4j
@Component
public class GoogleCalendarClient {

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;

    public GoogleCalendarClient(@Qualifier("googleCalendarWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @CircuitBreaker(name = "googleCalendar")
    @Retry(name = "googleCalendar")
    public GoogleEvent insertEvent(String accessToken, String calendarId, GoogleEvent event) {
        log.debug("Inserting event into calendar {}", calendarId);
        return call("insert event", webClient.post()
                .uri("/calendars/{calendarId}/events", calendarId)
                .headers(h -> h.setBearerAuth(accessToken))
                .bodyValue(event)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, Scope.CALENDAR))
                .bodyToMono(GoogleEvent.class));
    }

    /**
     * Replace an event.
     *
     * @throws EventNotFoundException if the event was deleted remotely
     */
    @CircuitBreaker(name = "googleCalendar")
    @Retry(name = "googleCalendar")
    public GoogleEvent updateEvent(String accessToken, String calendarId, String eventId, GoogleEvent event) {
        log.debug("Updating event {} in calendar {}", eventId, calendarId);
        return call("update event", webClient.put()
                .uri("/calendars/{calendarId}/events/{eventId}", calendarId, eventId)
                .headers(h -> h.setBearerAuth(accessToken))
                .bodyValue(event)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, Scope.EVENT))
                .bodyToMono(GoogleEvent.class));
    }

    /**
     * Delete an event. An event that is already gone counts as deleted.
     *
     * @return false if the event did not exist anymore
     */
    @CircuitBreaker(name = "googleCalendar")
    @Retry(name = "googleCalendar")
    public boolean deleteEvent(String accessToken, String calendarId, String eventId) {
        log.debug("Deleting event {} from calendar {}", eventId, calendarId);
        try {
            call("delete event", webClient.delete()
                    .uri("/calendars/{calendarId}/events/{eventId}", calendarId, eventId)
                    .headers(h -> h.setBearerAuth(accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toError(response, Scope.EVENT))
                    .toBodilessEntity());
            return true;
        } catch (EventNotFoundException e) {
            log.debug("Event {} already deleted", eventId);
            return false;
        }
    }

    @CircuitBreaker(name = "googleCalendar")
    @Retry(name = "googleCalendar")
    public List<GoogleEvent> listEvents(String accessToken, String calendarId, Instant timeMin, Instant timeMax) {
        var events = new ArrayList<GoogleEvent>();
        String pageToken = null;
        do {
            final var currentPage = pageToken;
            var page = call("list events", webClient.get()
                    .uri(builder -> {
                        builder.path("/calendars/{calendarId}/events")
                                .queryParam("timeMin", timeMin.toString())
                                .queryParam("timeMax", timeMax.toString())
                                .queryParam("singleEvents", "true")
                                .queryParam("maxResults", 250);
                        if (currentPage != null) {
                            builder.queryParam("pageToken", currentPage);
                        }
                        return builder.build(calendarId);
                    })
                    .headers(h -> h.setBearerAuth(accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toError(response, Scope.CALENDAR))
                    .bodyToMono(EventList.class));
            if (page == null) {
                break;
            }
            if (page.getItems() != null) {
                events.addAll(page.getItems());
            }
            pageToken = page.getNextPageToken();
        } while (pageToken != null);
        return events;
    }

    @CircuitBreaker(name = "googleCalendar")
    @Retry(name = "googleCalendar")
    public List<CalendarEntry> listCalendars(String accessToken) {
        var calendars = new ArrayList<CalendarEntry>();
        String pageToken = null;
        do {
            final var currentPage = pageToken;
            var page = call("list calendars", webClient.get()
                    .uri(builder -> {
                        builder.path("/users/me/calendarList").queryParam("minAccessRole", "writer");
                        if (currentPage != null) {
                            builder.queryParam("pageToken", currentPage);
                        }
                        return builder.build();
                    })
                    .headers(h -> h.setBearerAuth(accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toError(response, Scope.CALENDAR))
                    .bodyToMono(CalendarList.class));
            if (page == null) {
                break;
            }
            if (page.getItems() != null) {
                calendars.addAll(page.getItems());
            }
            pageToken = page.getNextPageToken();
        } while (pageToken != null);
        return calendars;
    }

    @CircuitBreaker(name = "googleCalendar")
    @Retry(name = "googleCalendar")
    public CalendarEntry createCalendar(String accessToken, String summary, String timeZone) {
        log.info("Creating calendar '{}'", summary);
        return call("create calendar", webClient.post()
                .uri("/calendars")
                .headers(h -> h.setBearerAuth(accessToken))
                .bodyValue(CalendarEntry.builder().summary(summary).timeZone(timeZone).build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, Scope.CALENDAR))
                .bodyToMono(CalendarEntry.class));
    }

    private <T> T call(String operation, Mono<T> request) {
        try {
            return request.timeout(CALL_TIMEOUT).block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Google Calendar {} failed: {}", operation, e.getMessage());
            throw new ExternalServiceException(GoogleApiErrors.SERVICE_NAME, e);
        }
    }

    private Mono<? extends Throwable> toError(ClientResponse response, Scope scope) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> GoogleApiErrors.toException(response.statusCode().value(), body, scope));
    }
}
