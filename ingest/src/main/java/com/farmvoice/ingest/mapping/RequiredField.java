package com.farmvoice.ingest.mapping;

import java.util.Map;
import java.util.function.Predicate;

/**
 * A field the destination system insists on.
 *
 * @param name        extracted field name
 * @param description human-readable text shown to the person who recorded the audio
 * @param appliesWhen whether the field is required for this particular extraction
 */
public record RequiredField(String name, String description, Predicate<Map<String, Object>> appliesWhen) {

    public static RequiredField always(String name, String description) {
        return new RequiredField(name, description, fields -> true);
    }

    public static RequiredField when(String name, String description, Predicate<Map<String, Object>> condition) {
        return new RequiredField(name, description, condition);
    }

    /** Required here and absent or empty in {@code fields}. */
    public boolean isMissingFrom(Map<String, Object> fields) {
        return appliesWhen.test(fields) && FieldValidator.isEmpty(fields.get(name));
    }
}
