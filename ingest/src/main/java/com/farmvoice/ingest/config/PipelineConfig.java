package com.farmvoice.ingest.config;

import com.farmvoice.ingest.retry.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wiring for the pipeline's worker pool and retry policy.
 */
@Configuration
public class PipelineConfig {

    private final PipelineProperties properties;

    public PipelineConfig(PipelineProperties properties) {
        this.properties = properties;
    }

    /**
     * Bounded pool that runs one pipeline task per job.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Submitting
     * happens on request threads, so a full queue is reported to the
     * dispatcher instead of running the pipeline on the caller; the job stays
     * UPLOADED and the recovery sweep picks it up later.
     */
    @Bean(name = "pipelineExecutor")
    public TaskExecutor pipelineExecutor() {
        PipelineProperties.Worker worker = properties.getWorker();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(worker.getCorePoolSize(), worker.getMaxPoolSize()));
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix(worker.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public RetryPolicy extractionRetryPolicy() {
        PipelineProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBackoffUnit());
    }
}
