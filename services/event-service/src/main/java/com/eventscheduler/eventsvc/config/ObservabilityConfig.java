package com.eventscheduler.eventsvc.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    private static final String SERVICE = "event-service";

    @Bean
    public Counter registrationCounter(MeterRegistry registry) {
        return Counter.builder("user.registration.total")
                .description("Total user registrations")
                .tag("service", SERVICE)
                .register(registry);
    }

    @Bean
    public Counter verificationCounter(MeterRegistry registry) {
        return Counter.builder("user.email.verification.total")
                .description("Total email verifications")
                .tag("service", SERVICE)
                .register(registry);
    }

    @Bean
    public Counter resendCounter(MeterRegistry registry) {
        return Counter.builder("user.email.resend.total")
                .description("Total verification resend requests")
                .tag("service", SERVICE)
                .register(registry);
    }

    @Bean
    public Counter profileUpdateCounter(MeterRegistry registry) {
        return Counter.builder("user.profile.update.total")
                .description("Total email changes")
                .tag("service", SERVICE)
                .register(registry);
    }

    @Bean
    public Counter joinCounter(MeterRegistry registry) {
        return Counter.builder("event.participation.join.total")
                .description("Total successful event joins")
                .tag("service", SERVICE)
                .register(registry);
    }

    @Bean
    public Counter rateLimitCounter(MeterRegistry registry) {
        return Counter.builder("rate.limit.exceeded.total")
                .description("Total rate limit exceeded events")
                .tag("service", SERVICE)
                .register(registry);
    }

    @Bean
    public Counter taskCompletedCounter(MeterRegistry registry) {
        return Counter.builder("tasks.completed.total")
                .description("Background tasks completed")
                .tag("service", SERVICE)
                .register(registry);
    }

    @Bean
    public Counter taskFailedCounter(MeterRegistry registry) {
        return Counter.builder("tasks.failed.total")
                .description("Background tasks that exhausted their retries")
                .tag("service", SERVICE)
                .register(registry);
    }
}
