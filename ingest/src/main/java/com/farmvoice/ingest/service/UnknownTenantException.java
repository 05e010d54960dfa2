package com.farmvoice.ingest.service;

import java.util.UUID;

public class UnknownTenantException extends RuntimeException {
    public UnknownTenantException(UUID tenantId) {
        super("Client not found: " + tenantId);
    }
}
