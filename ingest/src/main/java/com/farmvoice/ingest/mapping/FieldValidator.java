package com.farmvoice.ingest.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks extracted fields against a tenant mapping's validation rules.
 *
 * Required and type violations are errors. Pattern mismatches are only
 * warnings: transcripts are noisy, so a regex is treated as a hint.
 *
 * Pure utility (only static methods, no I/O).
 */
public final class FieldValidator {

    private FieldValidator() {}

    public static ValidationResult validate(Map<String, Object> fields, Map<String, ValidationRule> rules) {
        List<String> errors   = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        rules.forEach((field, rule) -> {
            Object value = fields.get(field);

            if (rule.required() && isEmpty(value)) {
                errors.add("Required field '" + field + "' is missing");
                return;
            }
            if (value == null) {
                return;
            }

            Optional<FieldType> type = FieldType.fromName(rule.type());
            if (type.isPresent() && !type.get().matches(value)) {
                errors.add("Field '" + field + "' has invalid type. Expected " + rule.type());
            }

            if (rule.pattern() != null && !rule.pattern().isEmpty()) {
                try {
                    // lookingAt: anchored at the start only, like a prefix match
                    if (!Pattern.compile(rule.pattern()).matcher(value.toString()).lookingAt()) {
                        warnings.add("Field '" + field + "' doesn't match expected pattern");
                    }
                } catch (PatternSyntaxException e) {
                    warnings.add("Field '" + field + "' has an invalid pattern: " + e.getDescription());
                }
            }
        });

        return new ValidationResult(errors, warnings);
    }

    /** Null, a blank string, or an empty collection or map. */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.toString().isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }
}
