package com.farmvoice.ingest.mapping;

import java.util.List;

/**
 * Outcome of {@link FieldValidator#validate}. Warnings never affect {@link #ok()}.
 */
public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors   = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean ok() {
        return errors.isEmpty();
    }
}
