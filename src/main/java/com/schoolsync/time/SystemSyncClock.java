package com.schoolsync.time;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

public class SystemSyncClock implements SyncClock {

    @Override
    public long monotonicMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        Thread.sleep(duration.toMillis());
    }
}
