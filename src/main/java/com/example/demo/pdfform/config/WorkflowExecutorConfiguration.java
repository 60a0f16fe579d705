package com.example.demo.pdfform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for workflows started in the background (HTTP-triggered runs).
 */
@Configuration
public class WorkflowExecutorConfiguration {
    public static final String WORKFLOW_EXECUTOR = "workflowExecutor";

    @Bean(name = WORKFLOW_EXECUTOR)
    public ThreadPoolTaskExecutor workflowExecutor(PdfFormProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCommandThreads());
        executor.setMaxPoolSize(properties.getCommandThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("workflow-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
