package com.eventscheduler.eventsvc.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class TaskExecutorConfig {

    /**
     * Bounded pool for task handlers. A full queue rejects the task, which the listener then retries.
     */
    @Bean(name = "taskHandlerExecutor", destroyMethod = "shutdown")
    public ExecutorService taskHandlerExecutor(@Value("${app.tasks.worker.threads:4}") int threads,
                                               @Value("${app.tasks.worker.queue-capacity:100}") int queueCapacity) {
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new CustomizableThreadFactory("task-handler-"),
                new ThreadPoolExecutor.AbortPolicy());
    }
}
