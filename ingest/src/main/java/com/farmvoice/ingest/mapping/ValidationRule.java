package com.farmvoice.ingest.mapping;

import java.util.Map;

/**
 * Declarative constraint on one extracted field.
 *
 * @param type     declared type name ("string", "integer", "float", "boolean";
 *                 other names such as "date" are carried but not checked)
 * @param required field must be present and non-empty
 * @param unique   the CRM enforces uniqueness; informational here
 * @param pattern  regex hint; a mismatch only produces a warning
 */
public record ValidationRule(String type, boolean required, boolean unique, String pattern) {

    public static ValidationRule required(String type) {
        return new ValidationRule(type, true, false, null);
    }

    public static ValidationRule optional(String type) {
        return new ValidationRule(type, false, false, null);
    }

    public ValidationRule withPattern(String pattern) {
        return new ValidationRule(type, required, unique, pattern);
    }

    /**
     * Build a rule from its stored JSON object. Only a literal {@code true}
     * counts as required; legacy values such as "conditional" do not.
     */
    public static ValidationRule fromMap(Map<String, Object> raw) {
        if (raw == null) {
            return new ValidationRule(null, false, false, null);
        }
        Object type    = raw.get("type");
        Object pattern = raw.get("pattern");
        return new ValidationRule(
                type == null ? null : type.toString(),
                Boolean.TRUE.equals(raw.get("required")),
                Boolean.TRUE.equals(raw.get("unique")),
                pattern == null ? null : pattern.toString());
    }
}
