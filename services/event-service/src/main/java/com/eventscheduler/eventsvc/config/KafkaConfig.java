package com.eventscheduler.eventsvc.config;

import com.eventscheduler.eventsvc.infrastructure.worker.TaskWorker;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;

import java.time.Duration;
import java.util.UUID;

@Configuration
@Slf4j
public class KafkaConfig {

    @Bean
    public NewTopic tasksTopic(@Value("${app.tasks.topic:event-scheduler.tasks}") String topic,
                               @Value("${app.tasks.partitions:3}") int partitions) {
        return TopicBuilder.name(topic).partitions(partitions).replicas(1).build();
    }

    /**
     * Redelivers a failed task with exponential backoff; once retries are exhausted the task is marked FAILED.
     * Malformed messages are not retried.
     */
    @Bean
    public DefaultErrorHandler taskErrorHandler(TaskWorker taskWorker,
                                                @Value("${app.tasks.max-retries:3}") int maxRetries,
                                                @Value("${app.tasks.initial-backoff:PT1S}") Duration initialBackoff,
                                                @Value("${app.tasks.max-backoff:PT30S}") Duration maxBackoff) {
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(maxRetries);
        backOff.setInitialInterval(initialBackoff.toMillis());
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(maxBackoff.toMillis());

        DefaultErrorHandler errorHandler = new DefaultErrorHandler((record, ex) -> {
            UUID taskId = parseTaskId(record.key());
            if (taskId == null) {
                log.error("Dropping task message without a valid key: topic={}, offset={}",
                        record.topic(), record.offset(), ex);
                return;
            }
            taskWorker.markFailed(taskId, ex.getCause() != null ? ex.getCause() : ex);
        }, backOff);
        errorHandler.addNotRetryableExceptions(JsonProcessingException.class, IllegalArgumentException.class);
        return errorHandler;
    }

    private static UUID parseTaskId(Object key) {
        if (key == null) {
            return null;
        }
        try {
            return UUID.fromString(key.toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
