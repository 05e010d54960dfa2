package com.farmvoice.ingest.repository;

import com.farmvoice.ingest.model.SchemaMapping;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Query operations for the schema_mappings table.
 */
public interface SchemaMappingRepository extends JpaRepository<SchemaMapping, UUID> {

    /** Active mappings for a tenant, oldest first so extraction prompts are stable. */
    List<SchemaMapping> findByTenantIdAndActiveTrueOrderByCreatedAtAsc(UUID tenantId);
}
