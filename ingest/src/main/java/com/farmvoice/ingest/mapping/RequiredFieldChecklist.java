package com.farmvoice.ingest.mapping;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Domain-level required fields, checked on every extraction before any
 * tenant mapping is consulted.
 */
public interface RequiredFieldChecklist {

    /** Catalogue entries, in the order they are reported. */
    List<RequiredField> fields();

    default List<RequiredField> missingFields(Map<String, Object> extracted) {
        return fields().stream()
                .filter(f -> f.isMissingFrom(extracted))
                .toList();
    }

    /** The message stored on a job that is missing required information. */
    default String describeMissing(List<RequiredField> missing) {
        if (missing.isEmpty()) {
            return "";
        }
        String lines = missing.stream()
                .map(f -> "- " + f.description())
                .collect(Collectors.joining("\n"));
        return "The following required information is missing from your recording:\n\n"
                + lines
                + "\n\nPlease provide these details.";
    }
}
