package com.example.video_grid.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configures how many video jobs may run at once and the pool that executes them.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    public static final int MAX_CONCURRENCY_LIMIT = 10;

    @Min(1) @Max(MAX_CONCURRENCY_LIMIT)
    private int maxConcurrency = 2;
    @Min(1)
    private int executorThreads = 4;
    @Min(1)
    private int executorQueueCapacity = 500;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    /**
     * @return configured concurrency clamped to {@code [1, MAX_CONCURRENCY_LIMIT]}.
     */
    public int effectiveConcurrency() {
        return Math.max(1, Math.min(MAX_CONCURRENCY_LIMIT, maxConcurrency));
    }
}
