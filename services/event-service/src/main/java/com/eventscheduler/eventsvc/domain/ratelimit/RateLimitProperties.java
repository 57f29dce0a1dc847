package com.eventscheduler.eventsvc.domain.ratelimit;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    /** Disables limiting entirely when false. */
    @NotNull
    private Boolean enabled = true;

    /** Counter backend: {@code redis} or {@code local}. */
    @NotBlank
    private String store = "redis";

    @NotNull
    private FailureMode failureMode = FailureMode.LOCAL_FALLBACK;

    @NotBlank
    private String keyPrefix = "event-scheduler:ratelimit";

    /** Requests admitted per client IP per window. */
    @Min(1)
    private int requestsPerWindow = 100;

    /** Verification resends and password reset requests admitted per email address per window. */
    @Min(1)
    private int emailRequestsPerWindow = 3;

    /** Length of one fixed window, at least one second. */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration window = Duration.ofHours(1);

    @Min(1)
    private long localMaxKeys = 100_000;

    private List<String> bypassPaths = List.of("/actuator/**", "/swagger-ui/**", "/v3/api-docs/**");
}
