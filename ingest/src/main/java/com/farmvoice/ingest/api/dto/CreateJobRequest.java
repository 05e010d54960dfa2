package com.farmvoice.ingest.api.dto;

import java.util.UUID;

/**
 * Request body for POST /recordings.
 *
 * audioRef points at a recording already placed in storage by the upload
 * service (e.g. "tenant-a/2024/05/cow-17.m4a").
 */
public record CreateJobRequest(UUID tenantId, String audioRef) {}
