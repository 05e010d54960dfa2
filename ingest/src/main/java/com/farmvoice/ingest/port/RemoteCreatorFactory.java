package com.farmvoice.ingest.port;

import java.util.UUID;

/** Hands out the {@link RemoteCreator} bound to one tenant's CRM credentials. */
public interface RemoteCreatorFactory {

    /**
     * @throws PipelineException of kind REMOTE_SYNC if the tenant has no usable CRM configuration
     */
    RemoteCreator forTenant(UUID tenantId);
}
