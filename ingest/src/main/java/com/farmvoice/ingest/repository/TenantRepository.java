package com.farmvoice.ingest.repository;

import com.farmvoice.ingest.model.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/** Read access to the tenants table. */
public interface TenantRepository extends JpaRepository<Tenant, UUID> {
}
