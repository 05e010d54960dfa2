package com.farmvoice.ingest.service;

import java.util.UUID;

public class InactiveTenantException extends RuntimeException {
    public InactiveTenantException(UUID tenantId) {
        super("Client is not active: " + tenantId);
    }
}
