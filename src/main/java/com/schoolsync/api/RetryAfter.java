package com.schoolsync.api;

import java.net.http.HttpHeaders;
import java.time.Duration;

public final class RetryAfter {

    public static final Duration DEFAULT = Duration.ofSeconds(30);

    private RetryAfter() {
    }

    /**
     * Reads a delay-seconds {@code Retry-After} header; anything else yields the fallback.
     */
    public static Duration from(HttpHeaders headers, Duration fallback) {
        if (headers == null) {
            return fallback;
        }
        return headers.firstValue("Retry-After")
                .map(String::trim)
                .map(value -> {
                    try {
                        long seconds = Long.parseLong(value);
                        return seconds >= 0 ? Duration.ofSeconds(seconds) : fallback;
                    } catch (NumberFormatException e) {
                        return fallback;
                    }
                })
                .orElse(fallback);
    }
}
