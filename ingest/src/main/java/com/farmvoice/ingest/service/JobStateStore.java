package com.farmvoice.ingest.service;

import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import com.farmvoice.ingest.port.Extraction;
import com.farmvoice.ingest.port.Transcription;
import com.farmvoice.ingest.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Persists pipeline progress for one job at a time.
 *
 * Each public method is a single transaction that re-reads the job,
 * applies one stage's worth of changes and saves it, so a poller never
 * sees a status ahead of the data it describes.
 */
@Service
public class JobStateStore {

    private static final Logger log = LoggerFactory.getLogger(JobStateStore.class);

    private final JobRepository jobRepo;

    public JobStateStore(JobRepository jobRepo) {
        this.jobRepo = jobRepo;
    }

    @Transactional(readOnly = true)
    public Optional<Job> find(UUID jobId) {
        return jobRepo.findById(jobId);
    }

    /** Move along a plain pipeline edge (no new data). */
    @Transactional
    public Job advance(UUID jobId, JobStatus next) {
        Job job = load(jobId);
        JobStatus from = job.getStatus();
        job.transitionTo(next);
        log.info("Job {} {} -> {}", jobId, from, next);
        return jobRepo.save(job);
    }

    /** Store the transcript and move TRANSCRIBING → TRANSCRIBED. */
    @Transactional
    public Job recordTranscript(UUID jobId, Transcription transcription) {
        Job job = load(jobId);
        job.setTranscript(transcription.text(), transcription.confidence());
        job.transitionTo(JobStatus.TRANSCRIBED);
        log.info("Job {} TRANSCRIBING -> TRANSCRIBED (confidence={})", jobId, transcription.confidence());
        return jobRepo.save(job);
    }

    /** Store what the extractor produced. Status stays PROCESSING. */
    @Transactional
    public Job recordExtraction(UUID jobId, Extraction extraction) {
        Job job = load(jobId);
        job.setExtraction(extraction.entityType(), extraction.confidence(), extraction.fields());
        return jobRepo.save(job);
    }

    /** Store the CRM record id and move PROCESSING → SYNCED. */
    @Transactional
    public Job markSynced(UUID jobId, String remoteRecordId) {
        Job job = load(jobId);
        job.setRemoteRecordId(remoteRecordId);
        job.transitionTo(JobStatus.SYNCED);
        log.info("Job {} PROCESSING -> SYNCED (remote record {})", jobId, remoteRecordId);
        return jobRepo.save(job);
    }

    /**
     * Terminate the current run. A job that is already terminal is left
     * untouched, so a late failure cannot overwrite a finished run.
     */
    @Transactional
    public Job markFailed(UUID jobId, String reason) {
        Job job = load(jobId);
        if (job.getStatus().isTerminal()) {
            log.warn("Job {} already {}, not recording failure: {}", jobId, job.getStatus(), reason);
            return job;
        }
        JobStatus from = job.getStatus();
        job.fail(reason);
        log.warn("Job {} {} -> FAILED: {}", jobId, from, reason);
        return jobRepo.save(job);
    }

    /** Back to UPLOADED with all outputs of the previous attempt cleared. */
    @Transactional
    public Job resetForReprocess(UUID jobId) {
        Job job = load(jobId);
        JobStatus from = job.getStatus();
        job.resetForReprocess();
        log.info("Job {} reset {} -> UPLOADED for reprocessing", jobId, from);
        return jobRepo.save(job);
    }

    private Job load(UUID jobId) {
        return jobRepo.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Job not found: " + jobId));
    }
}
