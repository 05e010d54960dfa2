package com.farmvoice.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning for the recording pipeline, bound from {@code farmvoice.pipeline.*}.
 *
 * <p>Defaults suit a single instance on modest hardware; every value can be
 * overridden in application.yml or through environment variables.
 */
@Component
@ConfigurationProperties(prefix = "farmvoice.pipeline")
public class PipelineProperties {

    private Worker worker = new Worker();
    private Timeouts timeouts = new Timeouts();
    private Retry retry = new Retry();
    private Recovery recovery = new Recovery();

    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }

    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }

    /**
     * Pool that runs pipeline tasks, one task per job.
     */
    public static class Worker {
        private int corePoolSize = 4;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
        private String threadNamePrefix = "pipeline-";

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }

        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public String getThreadNamePrefix() { return threadNamePrefix; }
        public void setThreadNamePrefix(String threadNamePrefix) { this.threadNamePrefix = threadNamePrefix; }
    }

    /**
     * Upper bound on each capability call. A call that overruns fails its stage.
     */
    public static class Timeouts {
        private Duration storage = Duration.ofSeconds(30);
        private Duration transcription = Duration.ofMinutes(5);
        private Duration extraction = Duration.ofMinutes(2);
        private Duration remoteSync = Duration.ofMinutes(2);

        public Duration getStorage() { return storage; }
        public void setStorage(Duration storage) { this.storage = storage; }

        public Duration getTranscription() { return transcription; }
        public void setTranscription(Duration transcription) { this.transcription = transcription; }

        public Duration getExtraction() { return extraction; }
        public void setExtraction(Duration extraction) { this.extraction = extraction; }

        public Duration getRemoteSync() { return remoteSync; }
        public void setRemoteSync(Duration remoteSync) { this.remoteSync = remoteSync; }
    }

    /**
     * Backoff for rate-limited extraction.
     */
    public static class Retry {
        private int maxAttempts = 3;
        private Duration backoffUnit = Duration.ofSeconds(1);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getBackoffUnit() { return backoffUnit; }
        public void setBackoffUnit(Duration backoffUnit) { this.backoffUnit = backoffUnit; }
    }

    /**
     * Requeueing of jobs stranded in a non-terminal status.
     */
    public static class Recovery {
        private boolean enabled = true;
        private Duration stallThreshold = Duration.ofMinutes(15);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getStallThreshold() { return stallThreshold; }
        public void setStallThreshold(Duration stallThreshold) { this.stallThreshold = stallThreshold; }
    }
}
