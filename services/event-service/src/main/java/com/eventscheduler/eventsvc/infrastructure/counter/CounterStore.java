package com.eventscheduler.eventsvc.infrastructure.counter;

import java.time.Duration;

/**
 * Keyed counters with expiry, used for fixed-window rate limiting.
 */
public interface CounterStore {

    /**
     * Atomically increments the counter under {@code key} if its current value is below {@code limit}.
     * A counter that does not exist yet starts at zero and expires {@code ttl} after creation.
     * When the counter is already at the limit it is left unchanged.
     *
     * @throws CounterStoreUnavailableException if the backing store cannot be reached
     */
    CounterResult incrementIfBelow(String key, int limit, Duration ttl);

    String name();
}
