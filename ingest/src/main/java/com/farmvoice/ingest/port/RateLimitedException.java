package com.farmvoice.ingest.port;

/**
 * The extraction backend refused the call because of rate limiting.
 * The retry policy backs off and tries again; any other
 * {@link PipelineException} aborts immediately.
 */
public class RateLimitedException extends PipelineException {

    public RateLimitedException(String detail) {
        super(Kind.EXTRACTION, detail);
    }
}
