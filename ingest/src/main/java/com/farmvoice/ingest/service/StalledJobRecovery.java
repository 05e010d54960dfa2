package com.farmvoice.ingest.service;

import com.farmvoice.ingest.config.PipelineProperties;
import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import com.farmvoice.ingest.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Requeues jobs left in a non-terminal status with no run behind them.
 *
 * At startup every non-terminal job is an orphan of the previous process,
 * so all of them are resumed. While running, the sweep only touches jobs
 * that have not been updated for the stall threshold and are not in flight
 * here (a job waiting in a full queue, a write that failed mid-run).
 */
@Component
@EnableScheduling
public class StalledJobRecovery {

    private static final Logger log = LoggerFactory.getLogger(StalledJobRecovery.class);

    private final JobRepository                jobRepo;
    private final PipelineDispatcher           dispatcher;
    private final PipelineProperties.Recovery  settings;
    private final Clock                        clock;

    public StalledJobRecovery(JobRepository jobRepo,
                              PipelineDispatcher dispatcher,
                              PipelineProperties properties) {
        this(jobRepo, dispatcher, properties, Clock.systemUTC());
    }

    StalledJobRecovery(JobRepository jobRepo,
                       PipelineDispatcher dispatcher,
                       PipelineProperties properties,
                       Clock clock) {
        this.jobRepo    = jobRepo;
        this.dispatcher = dispatcher;
        this.settings   = properties.getRecovery();
        this.clock      = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!settings.isEnabled()) {
            return;
        }
        List<Job> orphans = jobRepo.findByStatusIn(JobStatus.nonTerminal());
        if (!orphans.isEmpty()) {
            log.info("Startup recovery: {} unfinished job(s) found", orphans.size());
        }
        resumeAll(orphans);
    }

    /**
     * Every 5 minutes by default. The delay counts from the end of the
     * previous sweep.
     */
    @Scheduled(fixedDelayString = "${farmvoice.pipeline.recovery.sweep-interval-ms:300000}",
               initialDelayString = "${farmvoice.pipeline.recovery.sweep-interval-ms:300000}")
    public void sweep() {
        if (!settings.isEnabled()) {
            return;
        }
        Instant cutoff = Instant.now(clock).minus(settings.getStallThreshold());
        List<Job> stale = jobRepo.findByStatusInAndUpdatedAtBefore(JobStatus.nonTerminal(), cutoff).stream()
                .filter(job -> !dispatcher.isInFlight(job.getId()))
                .toList();
        for (Job job : stale) {
            log.warn("Recovering stalled job {} (status={}, last update={})",
                    job.getId(), job.getStatus(), job.getUpdatedAt());
        }
        resumeAll(stale);
    }

    private void resumeAll(List<Job> jobs) {
        for (Job job : jobs) {
            try {
                dispatcher.resume(job.getId());
            } catch (RuntimeException e) {
                log.error("Could not resume job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
    }
}
