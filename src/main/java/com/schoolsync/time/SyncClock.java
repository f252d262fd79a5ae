package com.schoolsync.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source for pacing, backoff and cache expiry. All blocking waits of the
 * engine go through {@link #sleep(Duration)}.
 */
public interface SyncClock {

    /**
     * Monotonic milliseconds, only meaningful as a difference between two calls.
     */
    long monotonicMillis();

    Instant now();

    void sleep(Duration duration) throws InterruptedException;
}
