package com.schoolsync.identity;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.config.SyncConfig;
import com.schoolsync.time.SyncClock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Fixed-window call counter for the identity service. Once the counter comes
 * within {@link #HEADROOM} calls of the limit, {@link #admit()} blocks until
 * the window ends. Not thread-safe; the engine has a single caller.
 */
@ApplicationScoped
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final long WINDOW_MILLIS = 60_000L;
    static final int HEADROOM = 10;

    private final SyncClock clock;
    private final int limit;
    private int calls;
    private long windowResetAt;

    @Inject
    public RateLimiter(SyncConfig config, SyncClock clock) {
        this(config.getIdentityRateLimit(), clock);
    }

    public RateLimiter(int limit, SyncClock clock) {
        this.limit = limit;
        this.clock = clock;
        this.windowResetAt = clock.monotonicMillis() + WINDOW_MILLIS;
    }

    public void admit() throws InterruptedException {
        long now = clock.monotonicMillis();
        if (now > windowResetAt) {
            calls = 0;
            windowResetAt = now + WINDOW_MILLIS;
        }

        if (calls >= limit - HEADROOM) {
            long waitMillis = windowResetAt - now;
            if (waitMillis > 0) {
                log.warn("Close to the identity service limit ({} calls). Waiting {} ms", calls, waitMillis);
                clock.sleep(Duration.ofMillis(waitMillis));
                calls = 0;
                windowResetAt = clock.monotonicMillis() + WINDOW_MILLIS;
            }
        }
        calls++;
    }

    public int getCalls() {
        return calls;
    }

    public int getLimit() {
        return limit;
    }
}
