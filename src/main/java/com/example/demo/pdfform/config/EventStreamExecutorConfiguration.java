package com.example.demo.pdfform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads that pump event bus subscriptions out to server-sent event clients.
 *
 * Each open stream holds one thread for its lifetime, so no queue: a stream opened
 * while every thread is busy is rejected.
 */
@Configuration
public class EventStreamExecutorConfiguration {
    public static final String EVENT_STREAM_EXECUTOR = "eventStreamExecutor";

    @Bean(name = EVENT_STREAM_EXECUTOR)
    public ThreadPoolTaskExecutor eventStreamExecutor(PdfFormProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getEventStreamThreads());
        executor.setMaxPoolSize(properties.getEventStreamThreads());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("event-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
