package com.farmvoice.ingest.pipeline;

import com.farmvoice.ingest.mapping.FieldMapper;
import com.farmvoice.ingest.mapping.FieldValidator;
import com.farmvoice.ingest.mapping.RequiredField;
import com.farmvoice.ingest.mapping.RequiredFieldChecklist;
import com.farmvoice.ingest.mapping.ValidationResult;
import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import com.farmvoice.ingest.port.AudioBlob;
import com.farmvoice.ingest.port.BlobStore;
import com.farmvoice.ingest.port.Extraction;
import com.farmvoice.ingest.port.Extractor;
import com.farmvoice.ingest.port.MappingProvider;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import com.farmvoice.ingest.port.RemoteCreatorFactory;
import com.farmvoice.ingest.port.RemoteRecord;
import com.farmvoice.ingest.port.TenantMapping;
import com.farmvoice.ingest.port.Transcriber;
import com.farmvoice.ingest.port.Transcription;
import com.farmvoice.ingest.retry.RetryPolicy;
import com.farmvoice.ingest.service.JobStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one recording through the pipeline:
 *
 * <pre>
 *   fetch audio → TRANSCRIBING → transcribe → TRANSCRIBED → PROCESSING
 *     → extract (with retry) → required-field checklist → pick mapping
 *     → validate → map fields → create CRM record → SYNCED
 * </pre>
 *
 * Any stage can end the run with FAILED; the reason lands in the job's
 * error column and nothing is thrown back to the caller. Each status
 * write is its own transaction, so pollers see progress as it happens.
 *
 * Every run is timed and counted:
 * <pre>
 *   farmvoice.pipeline.duration{outcome}
 *   farmvoice.pipeline.runs{outcome="synced|storage|transcription|...|error"}
 * </pre>
 */
@Component
public class RecordingPipeline {

    private static final Logger log = LoggerFactory.getLogger(RecordingPipeline.class);

    static final String NO_MAPPINGS       = "No schema mappings configured for this client";
    static final String UNKNOWN_ENTITY    = "Could not determine entity type from transcription";
    static final String NO_MAPPING_PREFIX = "No schema mapping found for entity type: ";
    static final String NO_SPEECH         = "no speech recognized";

    private final JobStateStore          store;
    private final BlobStore              blobStore;
    private final Transcriber            transcriber;
    private final Extractor              extractor;
    private final MappingProvider        mappingProvider;
    private final RemoteCreatorFactory   remoteCreators;
    private final RequiredFieldChecklist checklist;
    private final RetryPolicy            retryPolicy;
    private final PortCalls              portCalls;
    private final MeterRegistry          meterRegistry;

    public RecordingPipeline(JobStateStore store,
                             BlobStore blobStore,
                             Transcriber transcriber,
                             Extractor extractor,
                             MappingProvider mappingProvider,
                             RemoteCreatorFactory remoteCreators,
                             RequiredFieldChecklist checklist,
                             RetryPolicy extractionRetryPolicy,
                             PortCalls portCalls,
                             MeterRegistry meterRegistry) {
        this.store           = store;
        this.blobStore       = blobStore;
        this.transcriber     = transcriber;
        this.extractor       = extractor;
        this.mappingProvider = mappingProvider;
        this.remoteCreators  = remoteCreators;
        this.checklist       = checklist;
        this.retryPolicy     = extractionRetryPolicy;
        this.portCalls       = portCalls;
        this.meterRegistry   = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run the pipeline for a job that is in UPLOADED.
     *
     * Blocks until the job is SYNCED or FAILED. Never throws: every
     * failure, expected or not, is recorded on the job.
     */
    public void process(UUID jobId) {
        MDC.put("jobId", jobId.toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            Optional<Job> found = store.find(jobId);
            if (found.isEmpty()) {
                log.warn("Job {} not found, nothing to process", jobId);
                outcome = "missing";
                return;
            }
            Job job = found.get();
            MDC.put("tenantId", job.getTenantId().toString());
            if (job.getStatus() != JobStatus.UPLOADED) {
                log.warn("Job {} is {}, expected UPLOADED; skipping run", jobId, job.getStatus());
                outcome = "skipped";
                return;
            }

            log.info("Processing job {} (audio={})", jobId, job.getAudioRef());
            runStages(job);
            outcome = "synced";
        } catch (PipelineException e) {
            outcome = e.getKind().name().toLowerCase();
            recordFailure(jobId, e.describe());
        } catch (Exception e) {
            log.error("Unexpected error processing job {}", jobId, e);
            recordFailure(jobId, "Unexpected error: " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("farmvoice.pipeline.duration", "outcome", outcome));
            meterRegistry.counter("farmvoice.pipeline.runs", "outcome", outcome).increment();
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private void runStages(Job job) {
        UUID jobId    = job.getId();
        UUID tenantId = job.getTenantId();

        // --- Transcription ---
        AudioBlob audio = portCalls.call(Kind.STORAGE, () -> blobStore.fetch(job.getAudioRef()));
        store.advance(jobId, JobStatus.TRANSCRIBING);

        Transcription transcription = portCalls.call(Kind.TRANSCRIPTION, () -> transcriber.transcribe(audio));
        if (transcription == null || transcription.text() == null || transcription.text().isBlank()) {
            throw new PipelineException(Kind.TRANSCRIPTION, NO_SPEECH);
        }
        store.recordTranscript(jobId, transcription);

        // --- Extraction ---
        store.advance(jobId, JobStatus.PROCESSING);

        List<TenantMapping> mappings = mappingProvider.activeMappings(tenantId);
        if (mappings.isEmpty()) {
            throw new PipelineException(Kind.MISSING_MAPPING, NO_MAPPINGS);
        }

        // Timeout applies per attempt; backoff sleeps happen between calls.
        Extraction extraction = retryPolicy.execute(() ->
                portCalls.call(Kind.EXTRACTION, () -> extractor.extract(transcription.text(), mappings)));
        if (extraction == null) {
            throw new PipelineException(Kind.EXTRACTION, "extractor returned no result");
        }
        store.recordExtraction(jobId, extraction);
        log.info("Extracted entity '{}' with {} fields (confidence={})",
                extraction.entityType(), extraction.fields().size(), extraction.confidence());

        if (extraction.isUnknown()) {
            throw new PipelineException(Kind.UNKNOWN_ENTITY, UNKNOWN_ENTITY);
        }

        List<RequiredField> missing = checklist.missingFields(extraction.fields());
        if (!missing.isEmpty()) {
            log.info("Missing required fields: {}", missing.stream().map(RequiredField::name).toList());
            throw new PipelineException(Kind.MISSING_REQUIRED_FIELDS, checklist.describeMissing(missing));
        }

        // --- Mapping & validation ---
        TenantMapping mapping = selectMapping(mappings, extraction.entityType());

        ValidationResult validation = FieldValidator.validate(extraction.fields(), mapping.validationRules());
        validation.warnings().forEach(w -> log.warn("Validation warning: {}", w));
        if (!validation.ok()) {
            throw new PipelineException(Kind.VALIDATION, String.join(", ", validation.errors()));
        }

        Map<String, Object> remoteFields = FieldMapper.mapFields(extraction.fields(), mapping.fieldMappings());

        // --- Remote sync ---
        RemoteRecord record = portCalls.call(Kind.REMOTE_SYNC, () ->
                remoteCreators.forTenant(tenantId).create(mapping.remoteEntityName(), remoteFields));
        if (record == null || record.id() == null || record.id().isBlank()) {
            throw new PipelineException(Kind.REMOTE_SYNC, "CRM did not return a record id");
        }
        store.markSynced(jobId, record.id());
    }

    /** First active mapping whose entity name matches, ignoring case. */
    static TenantMapping selectMapping(List<TenantMapping> mappings, String entityType) {
        return mappings.stream()
                .filter(m -> m.entityName() != null && m.entityName().equalsIgnoreCase(entityType))
                .findFirst()
                .orElseThrow(() -> new PipelineException(Kind.MISSING_MAPPING, NO_MAPPING_PREFIX + entityType));
    }

    private void recordFailure(UUID jobId, String reason) {
        try {
            store.markFailed(jobId, reason);
        } catch (RuntimeException e) {
            // Job stays non-terminal; the stall sweep requeues it.
            log.error("Could not record failure for job {} ({}): {}", jobId, reason, e.getMessage(), e);
        }
    }
}
