package com.eventscheduler.eventsvc.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops consuming tasks on shutdown and gives running handlers a bounded time to finish.
 * Unfinished tasks are not marked COMPLETED, so the broker redelivers them.
 */
@Configuration
@Slf4j
public class GracefulShutdownConfig {

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Bean
    public ApplicationListener<ContextClosedEvent> gracefulShutdownListener(
            KafkaListenerEndpointRegistry listenerRegistry,
            @Qualifier("taskHandlerExecutor") ExecutorService taskHandlerExecutor,
            @Value("${app.tasks.shutdown-grace:PT10S}") Duration grace) {
        return event -> {
            if (!shuttingDown.compareAndSet(false, true)) {
                return;
            }
            log.info("Received shutdown signal, stopping task consumption");

            MessageListenerContainer container = listenerRegistry.getListenerContainer("taskWorker");
            if (container != null && container.isRunning()) {
                container.stop();
            }

            taskHandlerExecutor.shutdown();
            try {
                if (!taskHandlerExecutor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Task handlers still running after {}, interrupting", grace);
                    taskHandlerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Graceful shutdown interrupted");
                taskHandlerExecutor.shutdownNow();
            }

            log.info("Graceful shutdown complete");
        };
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
}
