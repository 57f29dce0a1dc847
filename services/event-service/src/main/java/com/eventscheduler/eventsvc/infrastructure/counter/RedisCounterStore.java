package com.eventscheduler.eventsvc.infrastructure.counter;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Redis-backed counters. Check and increment run in a single Lua script so concurrent
 * callers across instances never push a counter past its limit.
 */
public class RedisCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    static final String CHECK_AND_INCREMENT = """
            local current = tonumber(redis.call('GET', KEYS[1]) or '0')
            if current >= tonumber(ARGV[1]) then
              return {0, current}
            end
            current = redis.call('INCR', KEYS[1])
            if current == 1 then
              redis.call('PEXPIRE', KEYS[1], ARGV[2])
            end
            return {1, current}
            """;

    @SuppressWarnings("rawtypes")
    private final RedisScript<List> script = new DefaultRedisScript<>(CHECK_AND_INCREMENT, List.class);

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;

    public RedisCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .recordExceptions(DataAccessException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        this.circuitBreaker = registry.circuitBreaker("redisCounterStore");
    }

    @Override
    public CounterResult incrementIfBelow(String key, int limit, Duration ttl) {
        try {
            List<?> reply = circuitBreaker.executeSupplier(() -> redisTemplate.execute(
                    script, List.of(key), String.valueOf(limit), String.valueOf(ttl.toMillis())));
            return toResult(reply);
        } catch (CallNotPermittedException e) {
            throw new CounterStoreUnavailableException("Redis circuit breaker is open", e);
        } catch (DataAccessException e) {
            log.warn("Redis counter update failed: {}", e.getMessage());
            throw new CounterStoreUnavailableException("Redis counter update failed", e);
        }
    }

    @Override
    public String name() {
        return "redis";
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    private static CounterResult toResult(List<?> reply) {
        if (reply == null || reply.size() < 2) {
            throw new CounterStoreUnavailableException("Unexpected reply from counter script: " + reply, null);
        }
        boolean admitted = ((Number) reply.get(0)).longValue() == 1L;
        long count = ((Number) reply.get(1)).longValue();
        return new CounterResult(admitted, count);
    }
}
