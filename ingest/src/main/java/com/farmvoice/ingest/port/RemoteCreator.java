package com.farmvoice.ingest.port;

import java.util.Map;

/**
 * Creates records in a tenant's CRM. Authentication and token refresh are
 * the implementation's business.
 */
public interface RemoteCreator {

    /**
     * @param entityName CRM entity set name
     * @param fields     CRM field name → value
     * @throws PipelineException of kind REMOTE_SYNC when the CRM rejects the
     *                           record or cannot be reached
     */
    RemoteRecord create(String entityName, Map<String, Object> fields);
}
