package com.eventscheduler.eventsvc.config;

import com.eventscheduler.eventsvc.domain.ratelimit.RateLimitProperties;
import com.eventscheduler.eventsvc.infrastructure.counter.CounterStore;
import com.eventscheduler.eventsvc.infrastructure.counter.LocalCounterStore;
import com.eventscheduler.eventsvc.infrastructure.counter.RedisCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Locale;

/**
 * Chooses the rate limiter's counter backend from {@code app.rate-limit.store}. The local store
 * always exists because it also serves as the fallback.
 */
@Configuration
@Slf4j
public class CounterStoreConfig {

    @Bean
    public LocalCounterStore localCounterStore(RateLimitProperties properties) {
        return new LocalCounterStore(properties.getLocalMaxKeys());
    }

    @Bean
    public CounterStore rateLimitCounterStore(RateLimitProperties properties,
                                              LocalCounterStore localCounterStore,
                                              ObjectProvider<StringRedisTemplate> redisTemplate) {
        String store = properties.getStore().trim().toLowerCase(Locale.ROOT);
        switch (store) {
            case "redis" -> {
                log.info("Rate limit counters stored in Redis, failure mode {}", properties.getFailureMode());
                return new RedisCounterStore(redisTemplate.getObject());
            }
            case "local" -> {
                log.info("Rate limit counters stored in process");
                return localCounterStore;
            }
            default -> throw new IllegalStateException("Unknown app.rate-limit.store: " + properties.getStore());
        }
    }
}
