package com.farmvoice.ingest.port;

import java.util.List;

/**
 * Classifies a transcript against the tenant's entities and pulls out
 * field values.
 */
public interface Extractor {

    /**
     * @param transcript the transcribed text
     * @param mappings   the tenant's active mappings; their entity names,
     *                   field names and detection keywords guide extraction
     * @throws RateLimitedException when the backend is rate limiting; safe to retry
     * @throws PipelineException    of kind EXTRACTION on any other failure
     */
    Extraction extract(String transcript, List<TenantMapping> mappings);
}
