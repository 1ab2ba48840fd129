package com.example.tasksync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Google Calendar and OAuth endpoint configuration
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.google")
public class GoogleApiProperties {
    @NotBlank
    private String calendarBaseUrl = "https://www.googleapis.com/calendar/v3";
    @NotBlank
    private String tokenUrl = "https://oauth2.googleapis.com/token";
    private String clientId;
    private String clientSecret;
    @Min(1)
    private int timeoutSeconds = 30;
}
