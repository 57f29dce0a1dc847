package com.eventscheduler.eventsvc.infrastructure.counter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process counters held in a Caffeine cache. Each entry expires a fixed time after it is created;
 * increments do not extend its life.
 */
public class LocalCounterStore implements CounterStore {

    private final Cache<String, LocalCounter> counters;

    public LocalCounterStore(long maximumSize) {
        this.counters = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new CreationExpiry())
                .build();
    }

    @Override
    public CounterResult incrementIfBelow(String key, int limit, Duration ttl) {
        AtomicBoolean admitted = new AtomicBoolean(false);
        LocalCounter counter = counters.asMap().compute(key, (k, existing) -> {
            if (existing == null) {
                if (limit <= 0) {
                    return new LocalCounter(0, ttl.toNanos());
                }
                admitted.set(true);
                return new LocalCounter(1, ttl.toNanos());
            }
            if (existing.count() >= limit) {
                return existing;
            }
            admitted.set(true);
            return existing.increment();
        });
        return new CounterResult(admitted.get(), counter.count());
    }

    @Override
    public String name() {
        return "local";
    }

    long currentValue(String key) {
        LocalCounter counter = counters.getIfPresent(key);
        return counter == null ? 0 : counter.count();
    }

    record LocalCounter(long count, long ttlNanos) {
        LocalCounter increment() {
            return new LocalCounter(count + 1, ttlNanos);
        }
    }

    private static final class CreationExpiry implements Expiry<String, LocalCounter> {

        @Override
        public long expireAfterCreate(String key, LocalCounter value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, LocalCounter value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, LocalCounter value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
