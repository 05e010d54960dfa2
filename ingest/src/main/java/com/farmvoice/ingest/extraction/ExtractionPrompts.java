package com.farmvoice.ingest.extraction;

import com.farmvoice.ingest.port.TenantMapping;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts for transcript classification and field extraction.
 *
 * The system prompt lists the tenant's entities with their source field
 * names and detection keywords, so the model answers in the same
 * vocabulary the field mappings use.
 */
final class ExtractionPrompts {

    private ExtractionPrompts() {}

    static String system(List<TenantMapping> mappings) {
        return SYSTEM_PROMPT.replace("{{ENTITIES}}", describeEntities(mappings));
    }

    static String user(String transcript) {
        return USER_PROMPT.replace("{{TRANSCRIPT}}", transcript);
    }

    static String describeEntities(List<TenantMapping> mappings) {
        return mappings.stream()
                .map(m -> """
                        Entity: %s
                        Fields: %s
                        Keywords: %s
                        """.formatted(
                        m.entityName(),
                        String.join(", ", m.fieldMappings().keySet()),
                        m.detectionKeywords().isEmpty() ? "N/A" : String.join(", ", m.detectionKeywords())))
                .collect(Collectors.joining("\n"));
    }

    private static final String SYSTEM_PROMPT = """
            You extract structured records from voice notes recorded by farm staff.
            The notes describe animals and farm operations.

            The entity types this farm uses, with their fields:

            {{ENTITIES}}
            For each transcription:
            1. Decide which entity type it describes.
            2. Extract every field value that is stated.
            3. Rate your confidence as HIGH, MEDIUM or LOW.

            Rules:
            - Only extract what is actually said. Do not invent values.
            - Use null for fields that are not mentioned.
            - Keep numbers, dates and identifiers exactly as spoken.
            - If the transcription matches none of the entity types, use entity_type "unknown".
            """;

    private static final String USER_PROMPT = """
            Transcription:
            "{{TRANSCRIPT}}"

            Respond with ONLY a JSON object of this shape:
            {
                "entity_type": "<one of the entity names above, or unknown>",
                "confidence": "HIGH|MEDIUM|LOW",
                "extracted_data": {
                    "field_name": "value"
                },
                "notes": "anything uncertain or worth flagging"
            }
            """;
}
