package com.farmvoice.ingest.port;

import com.farmvoice.ingest.mapping.ValidationRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of one active schema mapping for a tenant.
 *
 * @param entityName        label the extractor reports (e.g. "animal")
 * @param remoteEntityName  CRM entity set the record is created in
 * @param fieldMappings     extracted field name → CRM field name
 * @param validationRules   extracted field name → rule
 * @param detectionKeywords hints for the extractor's entity classification
 */
public record TenantMapping(String entityName,
                            String remoteEntityName,
                            Map<String, String> fieldMappings,
                            Map<String, ValidationRule> validationRules,
                            List<String> detectionKeywords) {

    public TenantMapping {
        fieldMappings     = Collections.unmodifiableMap(new LinkedHashMap<>(
                fieldMappings == null ? Map.of() : fieldMappings));
        validationRules   = Collections.unmodifiableMap(new LinkedHashMap<>(
                validationRules == null ? Map.of() : validationRules));
        detectionKeywords = detectionKeywords == null ? List.of() : List.copyOf(detectionKeywords);
    }
}
