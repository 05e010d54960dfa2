package com.farmvoice.ingest.retry;

import java.time.Duration;

/** Blocks the calling thread. Swapped out in tests to record backoff. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
