package com.example.tasksync.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request/Response DTOs for the Google Calendar v3 and OAuth token APIs
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Calendar Events ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GoogleEvent {
        private String id;
        private String summary;
        private String description;
        private EventDateTime start;
        private EventDateTime end;
        private String colorId;
        private String status;
        private ExtendedProperties extendedProperties;
    }

    /**
     * Either {@code date} (all-day) or {@code dateTime} plus {@code timeZone} is set
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventDateTime {
        private String date;
        private String dateTime;
        private String timeZone;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtendedProperties {
        @JsonProperty("private")
        private Map<String, String> privateProperties;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventList {
        private List<GoogleEvent> items;
        private String nextPageToken;
    }

    // === Calendars ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CalendarEntry {
        private String id;
        private String summary;
        private String timeZone;
        private String accessRole;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CalendarList {
        private List<CalendarEntry> items;
        private String nextPageToken;
    }

    // === OAuth ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;
        @JsonProperty("refresh_token")
        private String refreshToken;
        @JsonProperty("expires_in")
        private Long expiresIn;
        @JsonProperty("token_type")
        private String tokenType;
        private String scope;
    }
}
