package com.farmvoice.ingest.retry;

import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exponential backoff for rate-limited extraction calls.
 *
 * After a {@link RateLimitedException} on attempt {@code n} (counted from 0)
 * the policy sleeps {@code 2^n} backoff units and tries again, as long as an
 * attempt remains. Every other failure propagates at once. The sleep
 * happens on the job's own worker thread, so other jobs keep running.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    static final String EXHAUSTED = "Max retries exceeded due to rate limiting";

    private final int      maxAttempts;
    private final Duration backoffUnit;
    private final Sleeper  sleeper;

    public RetryPolicy(int maxAttempts, Duration backoffUnit, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoffUnit = backoffUnit;
        this.sleeper     = sleeper;
    }

    public RetryPolicy(int maxAttempts, Duration backoffUnit) {
        this(maxAttempts, backoffUnit, Sleeper.THREAD);
    }

    public int maxAttempts() { return maxAttempts; }

    /**
     * Run {@code call}, retrying on rate limiting.
     *
     * @throws PipelineException of kind EXTRACTION when every attempt was rate limited
     */
    public <T> T execute(Supplier<T> call) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RateLimitedException e) {
                if (attempt == maxAttempts - 1) {
                    log.warn("Rate limited on final attempt {}/{}: {}", attempt + 1, maxAttempts, e.getMessage());
                    break;
                }
                Duration wait = backoffUnit.multipliedBy(1L << attempt);
                log.warn("Rate limited (attempt {}/{}), retrying in {} ms", attempt + 1, maxAttempts, wait.toMillis());
                sleep(wait);
            }
        }
        throw new PipelineException(PipelineException.Kind.EXTRACTION, EXHAUSTED);
    }

    private void sleep(Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(PipelineException.Kind.EXTRACTION,
                    "Interrupted while backing off after rate limiting", e);
        }
    }
}
