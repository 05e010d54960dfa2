package com.farmvoice.ingest.model;

import java.util.Locale;

/** Coarse qualitative confidence reported by transcription and extraction. */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    /** Lenient parse of a model-reported level; anything unrecognised is LOW. */
    public static Confidence parse(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}
