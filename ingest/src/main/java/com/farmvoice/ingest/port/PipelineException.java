package com.farmvoice.ingest.port;

/**
 * A stage of the recording pipeline failed in a way the orchestrator
 * records on the job rather than propagating.
 *
 * Capability ports throw this with the failure detail only; the kind adds
 * the stage prefix that ends up in the job's error text (see
 * {@link #describe()}).
 */
public class PipelineException extends RuntimeException {

    public enum Kind {
        STORAGE("Audio retrieval failed"),
        TRANSCRIPTION("Transcription failed"),
        MISSING_MAPPING(null),
        EXTRACTION("Extraction failed"),
        UNKNOWN_ENTITY(null),
        MISSING_REQUIRED_FIELDS(null),
        VALIDATION("Validation errors"),
        REMOTE_SYNC("Remote sync failed");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        /** Prefix placed in front of the detail, or null when the detail stands alone. */
        public String prefix() { return prefix; }
    }

    private final Kind kind;

    public PipelineException(Kind kind, String detail) {
        super(detail);
        this.kind = kind;
    }

    public PipelineException(Kind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    /** The text stored in the job's error column. */
    public String describe() {
        String detail = getMessage() == null || getMessage().isBlank() ? "unknown error" : getMessage();
        return kind.prefix() == null ? detail : kind.prefix() + ": " + detail;
    }
}
