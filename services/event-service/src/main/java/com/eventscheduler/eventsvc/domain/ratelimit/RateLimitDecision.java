package com.eventscheduler.eventsvc.domain.ratelimit;

import java.time.Duration;

public sealed interface RateLimitDecision permits RateLimitDecision.Allowed, RateLimitDecision.Blocked {

    boolean isAllowed();

    record Allowed(long count) implements RateLimitDecision {
        @Override
        public boolean isAllowed() {
            return true;
        }
    }

    /**
     * @param retryAfter time left until the current window ends
     */
    record Blocked(Duration retryAfter) implements RateLimitDecision {
        @Override
        public boolean isAllowed() {
            return false;
        }
    }
}
