package com.farmvoice.ingest.mapping;

import com.farmvoice.ingest.model.SchemaMapping;
import com.farmvoice.ingest.port.MappingProvider;
import com.farmvoice.ingest.port.TenantMapping;
import com.farmvoice.ingest.repository.SchemaMappingRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Serves tenant mappings straight from the schema_mappings table,
 * converting the stored JSON rule objects into typed {@link ValidationRule}s.
 */
@Component
public class JpaMappingProvider implements MappingProvider {

    private final SchemaMappingRepository mappingRepo;

    public JpaMappingProvider(SchemaMappingRepository mappingRepo) {
        this.mappingRepo = mappingRepo;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TenantMapping> activeMappings(UUID tenantId) {
        return mappingRepo.findByTenantIdAndActiveTrueOrderByCreatedAtAsc(tenantId).stream()
                .map(JpaMappingProvider::toTenantMapping)
                .toList();
    }

    static TenantMapping toTenantMapping(SchemaMapping sm) {
        Map<String, ValidationRule> rules = new LinkedHashMap<>();
        if (sm.getValidationRules() != null) {
            sm.getValidationRules().forEach((field, raw) -> rules.put(field, ValidationRule.fromMap(raw)));
        }
        return new TenantMapping(
                sm.getEntityName(),
                sm.getRemoteEntityName(),
                sm.getFieldMappings(),
                rules,
                sm.getDetectionKeywords());
    }
}
