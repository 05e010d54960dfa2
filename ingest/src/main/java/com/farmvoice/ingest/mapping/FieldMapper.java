package com.farmvoice.ingest.mapping;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renames extracted fields to CRM field names. Fields without a mapping
 * are dropped and never reach the CRM.
 */
public final class FieldMapper {

    private FieldMapper() {}

    /**
     * @param extracted    extracted field name → value (null values allowed)
     * @param mappingTable extracted field name → CRM field name
     * @return CRM field name → value, in the extracted map's order
     */
    public static Map<String, Object> mapFields(Map<String, Object> extracted, Map<String, String> mappingTable) {
        Map<String, Object> mapped = new LinkedHashMap<>();
        extracted.forEach((field, value) -> {
            String destination = mappingTable.get(field);
            if (destination != null) {
                mapped.put(destination, value);
            }
        });
        return mapped;
    }
}
