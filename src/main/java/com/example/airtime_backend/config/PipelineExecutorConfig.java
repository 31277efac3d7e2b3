package com.example.airtime_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the thread pool used by {@link com.example.airtime_backend.service.PipelineScheduler}
 * to run one pipeline task per channel.
 */
@Configuration
@EnableConfigurationProperties(PipelineExecutorProperties.class)
public class PipelineExecutorConfig {

    @Bean(name = "pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PipelineExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
