package com.example.airtime_backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizes the pool that runs channel pipelines in parallel.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline.executor")
public class PipelineExecutorProperties {

    @Min(1)
    private int threads = 4;
    @PositiveOrZero
    private int queueCapacity = 100;
    private int awaitTerminationSeconds = 60;

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getAwaitTerminationSeconds() {
        return awaitTerminationSeconds;
    }

    public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
        this.awaitTerminationSeconds = awaitTerminationSeconds;
    }
}
