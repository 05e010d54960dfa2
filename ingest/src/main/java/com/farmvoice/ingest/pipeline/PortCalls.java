package com.farmvoice.ingest.pipeline;

import com.farmvoice.ingest.config.PipelineProperties;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs capability-port calls under a per-stage deadline.
 *
 * The call executes on a helper thread while the job's worker waits up to
 * the stage timeout. An overrun cancels the call (interrupting it) and
 * fails the stage; any exception that is not already a
 * {@link PipelineException} is wrapped in one of the stage's kind.
 */
@Component
public class PortCalls {

    private static final Logger log = LoggerFactory.getLogger(PortCalls.class);

    private final PipelineProperties.Timeouts timeouts;
    private final ExecutorService callers;

    public PortCalls(PipelineProperties properties) {
        this.timeouts = properties.getTimeouts();
        this.callers  = Executors.newCachedThreadPool(daemonThreads("port-call-"));
    }

    public <T> T call(Kind kind, Supplier<T> call) {
        return call(kind, timeoutFor(kind), call);
    }

    <T> T call(Kind kind, Duration timeout, Supplier<T> call) {
        // Carry jobId/tenantId over to the helper thread's log lines.
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = callers.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.get();
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call timed out after {} ms", kind, timeout.toMillis());
            throw new PipelineException(kind, "timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineException(kind, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pe) {
                throw pe;
            }
            String detail = cause == null || cause.getMessage() == null
                    ? String.valueOf(cause)
                    : cause.getMessage();
            throw new PipelineException(kind, detail, cause);
        }
    }

    Duration timeoutFor(Kind kind) {
        return switch (kind) {
            case STORAGE       -> timeouts.getStorage();
            case TRANSCRIPTION -> timeouts.getTranscription();
            case EXTRACTION    -> timeouts.getExtraction();
            case REMOTE_SYNC   -> timeouts.getRemoteSync();
            default -> throw new IllegalArgumentException("No capability call for stage " + kind);
        };
    }

    @PreDestroy
    void shutdown() {
        callers.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
