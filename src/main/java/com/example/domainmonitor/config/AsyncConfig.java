package com.example.domainmonitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for background monitor registration work (creation and region changes).
 * The queue is bounded; when it is full the submitting thread runs the task itself,
 * and pending tasks are drained on shutdown.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "monitorExecutor")
    public ThreadPoolTaskExecutor monitorExecutor(MonitorProperties properties) {
        MonitorProperties.OrchestratorConfig config = properties.getOrchestrator();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorkerThreads());
        executor.setMaxPoolSize(config.getWorkerThreads());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("monitor-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
