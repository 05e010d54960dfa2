package com.farmvoice.ingest.api.dto;

import com.farmvoice.ingest.model.Confidence;
import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for every /recordings endpoint. Mirrors the job row, so a
 * poller sees the transcript, extraction and error as soon as they are stored.
 */
public record JobResponse(
        UUID                id,
        UUID                tenantId,
        String              audioRef,
        JobStatus           status,
        String              transcript,
        Confidence          transcriptConfidence,
        String              entityType,
        Confidence          extractionConfidence,
        Map<String, Object> extractedFields,
        String              remoteRecordId,
        String              error,
        Instant             createdAt,
        Instant             updatedAt,
        Instant             completedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getTenantId(),
                job.getAudioRef(),
                job.getStatus(),
                job.getTranscript(),
                job.getTranscriptConfidence(),
                job.getEntityType(),
                job.getExtractionConfidence(),
                job.getExtractedFields(),
                job.getRemoteRecordId(),
                job.getError(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt()
        );
    }
}
