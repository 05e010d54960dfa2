package com.farmvoice.ingest.port;

import java.util.List;
import java.util.UUID;

/** Looks up a tenant's active schema mappings. */
public interface MappingProvider {

    /** Active mappings in a stable order; empty when the tenant has none. */
    List<TenantMapping> activeMappings(UUID tenantId);
}
