package com.farmvoice.ingest.port;

import com.farmvoice.ingest.model.Confidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured data pulled out of a transcript.
 *
 * @param entityType the entity label, or {@value #UNKNOWN_ENTITY} when the
 *                   transcript could not be classified
 * @param confidence extractor's self-reported confidence
 * @param fields     extracted field values; values keep their JSON runtime
 *                   types (String, Integer/Long, Double, Boolean, Map, List)
 *                   and may be null
 * @param notes      free-text remarks from the extractor, may be null
 */
public record Extraction(String entityType, Confidence confidence,
                         Map<String, Object> fields, String notes) {

    public static final String UNKNOWN_ENTITY = "unknown";

    public Extraction {
        // LinkedHashMap rather than Map.copyOf: null values are meaningful here.
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean isUnknown() {
        return entityType == null || entityType.isBlank() || UNKNOWN_ENTITY.equalsIgnoreCase(entityType);
    }
}
