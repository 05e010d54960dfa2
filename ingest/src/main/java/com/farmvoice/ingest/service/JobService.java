package com.farmvoice.ingest.service;

import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.Tenant;
import com.farmvoice.ingest.repository.JobRepository;
import com.farmvoice.ingest.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job lifecycle as seen from the outside: create, look up, list, reprocess.
 *
 * The pipeline itself runs in the background; every method here returns as
 * soon as the job row is written and the run has been handed off.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT     = 1000;

    private final JobRepository      jobRepo;
    private final TenantRepository   tenantRepo;
    private final PipelineDispatcher dispatcher;

    public JobService(JobRepository jobRepo,
                      TenantRepository tenantRepo,
                      PipelineDispatcher dispatcher) {
        this.jobRepo    = jobRepo;
        this.tenantRepo = tenantRepo;
        this.dispatcher = dispatcher;
    }

    // ------------------------------------------------------------------
    // Job creation
    // ------------------------------------------------------------------

    /**
     * Register an uploaded recording and start processing it.
     *
     * Not transactional: the row must be committed before the worker
     * thread looks for it.
     *
     * @throws UnknownTenantException  if the tenant does not exist
     * @throws InactiveTenantException if the tenant is switched off
     */
    public Job create(UUID tenantId, String audioRef) {
        Tenant tenant = tenantRepo.findById(tenantId)
                .orElseThrow(() -> new UnknownTenantException(tenantId));
        if (!tenant.isActive()) {
            throw new InactiveTenantException(tenantId);
        }

        Job job = jobRepo.save(new Job(tenantId, audioRef));
        log.info("Job {} created for tenant '{}' (audio={})", job.getId(), tenant.getName(), audioRef);

        dispatcher.submit(job.getId());
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    /**
     * Newest first. A null tenant lists across all tenants.
     * Limit is clamped to 1..1000 and a negative offset counts as 0.
     */
    @Transactional(readOnly = true)
    public List<Job> list(UUID tenantId, Integer offset, Integer limit) {
        int safeOffset = offset == null ? 0 : Math.max(0, offset);
        int safeLimit  = limit == null ? DEFAULT_LIMIT : Math.min(MAX_LIMIT, Math.max(1, limit));
        return tenantId == null
                ? jobRepo.findNewestFirst(safeOffset, safeLimit)
                : jobRepo.findNewestFirstByTenant(tenantId, safeOffset, safeLimit);
    }

    // ------------------------------------------------------------------
    // Reprocess
    // ------------------------------------------------------------------

    /**
     * Run a job again from scratch, whatever its current status.
     *
     * If a run is in flight the rerun is folded into it and the job is
     * returned as it stands; otherwise it is reset to UPLOADED straight away.
     * A full worker pool leaves the reset job for the recovery sweep.
     *
     * @return empty if no such job exists
     */
    public Optional<Job> reprocess(UUID id) {
        if (!jobRepo.existsById(id)) {
            return Optional.empty();
        }
        if (dispatcher.reprocess(id)) {
            log.info("Reprocess requested for job {}: run started", id);
        } else if (dispatcher.isInFlight(id)) {
            log.info("Reprocess requested for job {}: rerun after the current attempt", id);
        } else {
            log.info("Reprocess requested for job {}: worker pool full, waiting for the recovery sweep", id);
        }
        return jobRepo.findById(id);
    }
}
