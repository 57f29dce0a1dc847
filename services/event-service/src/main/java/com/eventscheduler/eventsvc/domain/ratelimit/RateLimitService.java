package com.eventscheduler.eventsvc.domain.ratelimit;

import com.eventscheduler.eventsvc.infrastructure.counter.CounterResult;
import com.eventscheduler.eventsvc.infrastructure.counter.CounterStore;
import com.eventscheduler.eventsvc.infrastructure.counter.CounterStoreUnavailableException;
import com.eventscheduler.eventsvc.infrastructure.counter.LocalCounterStore;
import com.eventscheduler.eventsvc.shared.exception.RateLimitedException;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window rate limiting. A window starts at {@code floor(now, window)}; within it a client
 * is admitted until its counter reaches the threshold, after which every request is blocked
 * without being counted.
 */
@Service
public class RateLimitService {

    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    static final String REQUEST_SCOPE = "request:ip";
    static final String EMAIL_SCOPE = "request:email";

    private final RateLimitProperties properties;
    private final CounterStore primaryStore;
    private final LocalCounterStore fallbackStore;
    private final Clock clock;
    private final Counter rateLimitCounter;

    public RateLimitService(RateLimitProperties properties,
                            @Qualifier("rateLimitCounterStore") CounterStore primaryStore,
                            LocalCounterStore fallbackStore,
                            Clock clock,
                            @Qualifier("rateLimitCounter") Counter rateLimitCounter) {
        this.properties = properties;
        this.primaryStore = primaryStore;
        this.fallbackStore = fallbackStore;
        this.clock = clock;
        this.rateLimitCounter = rateLimitCounter;
    }

    /**
     * Admits or blocks one request from {@code clientId} at instant {@code now}.
     */
    public RateLimitDecision admit(String clientId, Instant now) {
        return admit(REQUEST_SCOPE, clientId, properties.getRequestsPerWindow(), now);
    }

    /**
     * @throws RateLimitedException when the client has used up the current window
     */
    public void checkRequestLimit(String ipAddress) {
        enforce(admit(ipAddress, clock.instant()));
    }

    /**
     * Stricter limit for actions that send mail to an address.
     *
     * @throws RateLimitedException when the address has used up the current window
     */
    public void checkEmailLimit(String normalizedEmail) {
        enforce(admit(EMAIL_SCOPE, normalizedEmail, properties.getEmailRequestsPerWindow(), clock.instant()));
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(properties.getEnabled());
    }

    String counterKey(String scope, String clientId, long windowStartMillis) {
        return properties.getKeyPrefix() + ":" + scope + ":" + clientId + ":" + windowStartMillis;
    }

    private RateLimitDecision admit(String scope, String clientId, int limit, Instant now) {
        if (!isEnabled()) {
            return new RateLimitDecision.Allowed(0);
        }
        Duration window = properties.getWindow();
        long windowMillis = window.toMillis();
        long nowMillis = now.toEpochMilli();
        long windowStart = nowMillis - Math.floorMod(nowMillis, windowMillis);
        long windowEnd = windowStart + windowMillis;
        String key = counterKey(scope, clientId, windowStart);

        CounterResult result;
        try {
            result = primaryStore.incrementIfBelow(key, limit, window);
        } catch (CounterStoreUnavailableException e) {
            result = onStoreFailure(key, limit, window, e);
        }

        if (result.admitted()) {
            return new RateLimitDecision.Allowed(result.count());
        }
        rateLimitCounter.increment();
        return new RateLimitDecision.Blocked(Duration.ofMillis(windowEnd - nowMillis));
    }

    private CounterResult onStoreFailure(String key, int limit, Duration window, CounterStoreUnavailableException e) {
        switch (properties.getFailureMode()) {
            case FAIL_OPEN -> {
                log.warn("Rate limit store {} unavailable, admitting request: {}", primaryStore.name(), e.getMessage());
                return CounterResult.admitted(0);
            }
            case FAIL_CLOSED -> {
                log.warn("Rate limit store {} unavailable, rejecting request: {}", primaryStore.name(), e.getMessage());
                return CounterResult.rejected(0);
            }
            default -> {
                log.warn("Rate limit store {} unavailable, counting locally: {}", primaryStore.name(), e.getMessage());
                return fallbackStore.incrementIfBelow(key, limit, window);
            }
        }
    }

    private static void enforce(RateLimitDecision decision) {
        if (decision instanceof RateLimitDecision.Blocked blocked) {
            throw new RateLimitedException(blocked.retryAfter());
        }
    }
}
