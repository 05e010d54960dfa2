package com.farmvoice.ingest.mapping;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

/**
 * Declared value types a validation rule can check. Matching is exact:
 * an integer is not a float and a boolean is not an integer.
 */
public enum FieldType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN;

    public boolean matches(Object value) {
        return switch (this) {
            case STRING  -> value instanceof CharSequence;
            case INTEGER -> value instanceof Integer || value instanceof Long
                         || value instanceof Short   || value instanceof Byte
                         || value instanceof BigInteger;
            case FLOAT   -> value instanceof Double || value instanceof Float
                         || value instanceof BigDecimal;
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    /**
     * Resolve a rule's type name. Names outside the checked set
     * ("date", "object", ...) resolve to empty and are not type-checked.
     */
    public static Optional<FieldType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "string"  -> Optional.of(STRING);
            case "integer" -> Optional.of(INTEGER);
            case "float"   -> Optional.of(FLOAT);
            case "boolean" -> Optional.of(BOOLEAN);
            default        -> Optional.empty();
        };
    }
}
