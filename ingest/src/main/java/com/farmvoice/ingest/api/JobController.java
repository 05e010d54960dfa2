package com.farmvoice.ingest.api;

import com.farmvoice.ingest.api.dto.CreateJobRequest;
import com.farmvoice.ingest.api.dto.JobResponse;
import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.service.InactiveTenantException;
import com.farmvoice.ingest.service.JobService;
import com.farmvoice.ingest.service.UnknownTenantException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for recording jobs.
 *
 * POST /recordings                  register an uploaded recording and start processing
 * GET  /recordings/{id}             poll a job
 * GET  /recordings                  list jobs, newest first (?tenantId=&offset=&limit=)
 * POST /recordings/{id}/reprocess   run a job again from the start
 */
@RestController
@RequestMapping("/recordings")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/recordings \
     *     -H "Content-Type: application/json" \
     *     -d '{"tenantId":"5f0c...","audioRef":"tenant-a/cow-17.m4a"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@RequestBody CreateJobRequest req) {
        if (req.tenantId() == null || req.audioRef() == null || req.audioRef().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "tenantId and audioRef are required");
        }
        try {
            Job job = jobService.create(req.tenantId(), req.audioRef());
            return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
        } catch (UnknownTenantException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (InactiveTenantException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return jobService.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) UUID tenantId,
                                  @RequestParam(defaultValue = "0") int offset,
                                  @RequestParam(defaultValue = "100") int limit) {
        return jobService.list(tenantId, offset, limit).stream()
                .map(JobResponse::from)
                .toList();
    }

    /**
     * Allowed in any status. While a run is in flight the reprocess is
     * queued behind it, so the response may still show the old status.
     */
    @PostMapping("/{id}/reprocess")
    public JobResponse reprocess(@PathVariable UUID id) {
        return jobService.reprocess(id)
                .map(JobResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Recording not found: " + id);
    }
}
