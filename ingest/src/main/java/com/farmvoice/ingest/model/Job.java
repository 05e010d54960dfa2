package com.farmvoice.ingest.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One voice recording and the state of its pipeline run.
 *
 * Status only moves through {@link #transitionTo}, {@link #fail} and
 * {@link #resetForReprocess}, which keep the invariant that {@code error}
 * is set exactly when the job is FAILED.
 *
 * DB table: recording_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "recording_jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    // Opaque to everything but the BlobStore.
    @Column(name = "audio_ref", nullable = false, updatable = false)
    private String audioRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.UPLOADED;

    @Column(columnDefinition = "TEXT")
    private String transcript;

    @Enumerated(EnumType.STRING)
    @Column(name = "transcript_confidence")
    private Confidence transcriptConfidence;

    @Column(name = "entity_type")
    private String entityType;

    @Enumerated(EnumType.STRING)
    @Column(name = "extraction_confidence")
    private Confidence extractionConfidence;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extracted_fields")
    private Map<String, Object> extractedFields;

    @Column(name = "remote_record_id")
    private String remoteRecordId;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(UUID tenantId, String audioRef) {
        this.tenantId = tenantId;
        this.audioRef = audioRef;
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Advance along a pipeline edge. Clears any error left over from
     * an earlier attempt.
     *
     * @throws IllegalStateException if the edge is not part of the pipeline
     */
    public void transitionTo(JobStatus next) {
        if (next == JobStatus.FAILED) {
            throw new IllegalStateException("Use fail(reason) to move job " + id + " to FAILED");
        }
        requireEdge(next);
        if (next == JobStatus.SYNCED && (remoteRecordId == null || remoteRecordId.isBlank())) {
            throw new IllegalStateException("Job " + id + " cannot be SYNCED without a remote record id");
        }
        this.status = next;
        this.error  = null;
        if (next == JobStatus.SYNCED) {
            this.completedAt = Instant.now();
        }
    }

    /**
     * Terminate the run. A blank reason is replaced so FAILED never
     * carries an empty error.
     */
    public void fail(String reason) {
        requireEdge(JobStatus.FAILED);
        this.status = JobStatus.FAILED;
        this.error  = (reason == null || reason.isBlank()) ? "Processing failed" : reason;
    }

    /** Back to UPLOADED with every output of the previous attempt discarded. */
    public void resetForReprocess() {
        this.status               = JobStatus.UPLOADED;
        this.error                = null;
        this.transcript           = null;
        this.transcriptConfidence = null;
        this.entityType           = null;
        this.extractionConfidence = null;
        this.extractedFields      = null;
        this.remoteRecordId       = null;
        this.completedAt          = null;
    }

    private void requireEdge(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal status transition for job " + id + ": " + status + " -> " + next);
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()                   { return id; }
    public UUID       getTenantId()             { return tenantId; }
    public String     getAudioRef()             { return audioRef; }
    public JobStatus  getStatus()               { return status; }
    public String     getTranscript()           { return transcript; }
    public Confidence getTranscriptConfidence() { return transcriptConfidence; }
    public String     getEntityType()           { return entityType; }
    public Confidence getExtractionConfidence() { return extractionConfidence; }
    public String     getRemoteRecordId()       { return remoteRecordId; }
    public String     getError()                { return error; }
    public Instant    getCreatedAt()            { return createdAt; }
    public Instant    getUpdatedAt()            { return updatedAt; }
    public Instant    getCompletedAt()          { return completedAt; }

    public Map<String, Object> getExtractedFields() { return extractedFields; }

    public void setTranscript(String transcript, Confidence confidence) {
        this.transcript           = transcript;
        this.transcriptConfidence = confidence;
    }

    public void setExtraction(String entityType, Confidence confidence, Map<String, Object> fields) {
        this.entityType           = entityType;
        this.extractionConfidence = confidence;
        this.extractedFields      = fields == null ? null : new LinkedHashMap<>(fields);
    }

    public void setRemoteRecordId(String remoteRecordId) { this.remoteRecordId = remoteRecordId; }
}
