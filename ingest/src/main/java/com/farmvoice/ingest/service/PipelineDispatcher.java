package com.farmvoice.ingest.service;

import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import com.farmvoice.ingest.pipeline.RecordingPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands jobs to the pipeline worker pool, at most one run per job.
 *
 * An in-flight table records which jobs currently own a worker. A
 * reprocess request for a job that is already running does not start a
 * second run; it sets a rerun flag, and the worker resets the job and
 * goes round again once the current run has ended.
 *
 * If the pool rejects a task the job simply stays where it is and the
 * recovery sweep picks it up later.
 */
@Service
public class PipelineDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PipelineDispatcher.class);

    private final RecordingPipeline pipeline;
    private final JobStateStore     store;
    private final TaskExecutor      executor;

    // jobId -> rerun requested. Guarded by 'this'.
    private final Map<UUID, Boolean> inFlight = new HashMap<>();

    public PipelineDispatcher(RecordingPipeline pipeline,
                              JobStateStore store,
                              @Qualifier("pipelineExecutor") TaskExecutor executor) {
        this.pipeline = pipeline;
        this.store    = store;
        this.executor = executor;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Start a run for a freshly created job.
     *
     * @return false if the job already has a run in flight or the pool was full
     */
    public boolean submit(UUID jobId) {
        if (!claim(jobId)) {
            return false;
        }
        return start(jobId);
    }

    /**
     * Reset the job to UPLOADED and run it again.
     *
     * @return true if a new run was started now, false if the request was
     *         folded into the run already in flight (or the pool was full)
     */
    public boolean reprocess(UUID jobId) {
        synchronized (this) {
            if (inFlight.containsKey(jobId)) {
                inFlight.put(jobId, Boolean.TRUE);
                log.info("Job {} is in flight; reprocess will run when the current attempt ends", jobId);
                return false;
            }
            inFlight.put(jobId, Boolean.FALSE);
        }
        try {
            store.resetForReprocess(jobId);
        } catch (RuntimeException e) {
            release(jobId);
            throw e;
        }
        return start(jobId);
    }

    /**
     * Pick up a job found in a non-terminal status with nobody working on it.
     * A job caught between stages is reset first, since its partial outputs
     * belong to a run that no longer exists.
     *
     * @return true if a run was started
     */
    public boolean resume(UUID jobId) {
        if (!claim(jobId)) {
            return false;
        }
        try {
            Optional<Job> job = store.find(jobId);
            if (job.isEmpty() || job.get().getStatus().isTerminal()) {
                release(jobId);
                return false;
            }
            if (job.get().getStatus() != JobStatus.UPLOADED) {
                log.warn("Resuming job {} stranded in {}", jobId, job.get().getStatus());
                store.resetForReprocess(jobId);
            }
        } catch (RuntimeException e) {
            release(jobId);
            throw e;
        }
        return start(jobId);
    }

    public synchronized boolean isInFlight(UUID jobId) {
        return inFlight.containsKey(jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private synchronized boolean claim(UUID jobId) {
        if (inFlight.containsKey(jobId)) {
            log.debug("Job {} already in flight, not starting another run", jobId);
            return false;
        }
        inFlight.put(jobId, Boolean.FALSE);
        return true;
    }

    private synchronized void release(UUID jobId) {
        inFlight.remove(jobId);
    }

    private boolean start(UUID jobId) {
        try {
            executor.execute(() -> runUntilSettled(jobId));
            return true;
        } catch (RejectedExecutionException e) {
            release(jobId);
            log.warn("Worker pool full, job {} left for the recovery sweep: {}", jobId, e.getMessage());
            return false;
        }
    }

    private void runUntilSettled(UUID jobId) {
        boolean released = false;
        try {
            while (true) {
                pipeline.process(jobId);

                synchronized (this) {
                    if (!Boolean.TRUE.equals(inFlight.get(jobId))) {
                        inFlight.remove(jobId);
                        released = true;
                        return;
                    }
                    inFlight.put(jobId, Boolean.FALSE);
                }

                try {
                    store.resetForReprocess(jobId);
                    log.info("Job {} rerunning after a reprocess request", jobId);
                } catch (RuntimeException e) {
                    log.error("Could not reset job {} for the pending rerun: {}", jobId, e.getMessage(), e);
                    return;
                }
            }
        } finally {
            // An Error out of the pipeline must not leave the job in flight.
            if (!released) {
                release(jobId);
            }
        }
    }
}
