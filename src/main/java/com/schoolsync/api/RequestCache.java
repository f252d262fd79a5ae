package com.schoolsync.api;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.config.SyncConfig;
import com.schoolsync.time.SyncClock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonStructure;

/**
 * Response cache for the directory API, keyed by a hash of the endpoint and
 * its parameters. Entries expire after the TTL and are evicted on lookup.
 */
@ApplicationScoped
public class RequestCache {

    private static final Logger log = LoggerFactory.getLogger(RequestCache.class);

    private final Map<String, Entry> entries = new HashMap<>();
    private final SyncClock clock;
    private final long ttlMillis;
    private long hits;
    private long misses;

    @Inject
    public RequestCache(SyncConfig config, SyncClock clock) {
        this(config.getCacheTtl(), clock);
    }

    public RequestCache(Duration ttl, SyncClock clock) {
        this.ttlMillis = ttl.toMillis();
        this.clock = clock;
    }

    public Optional<JsonStructure> get(String endpoint, Map<String, String> params) {
        String key = cacheKey(endpoint, params);
        Entry entry = entries.get(key);
        if (entry != null) {
            if (clock.monotonicMillis() - entry.storedAt < ttlMillis) {
                hits++;
                log.debug("Cache HIT for {}", endpoint);
                return Optional.of(entry.value);
            }
            entries.remove(key);
        }
        misses++;
        return Optional.empty();
    }

    public void set(String endpoint, Map<String, String> params, JsonStructure value) {
        entries.put(cacheKey(endpoint, params), new Entry(value, clock.monotonicMillis()));
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public int size() {
        return entries.size();
    }

    public String describeStats() {
        long total = hits + misses;
        double hitRate = total > 0 ? hits * 100.0 / total : 0.0;
        return String.format("size=%d, hits=%d, misses=%d, hit rate=%.1f%%", entries.size(), hits, misses, hitRate);
    }

    static String cacheKey(String endpoint, Map<String, String> params) {
        // TreeMap gives the same string regardless of insertion order.
        String canonical = endpoint + ":" + (params == null ? "{}" : new TreeMap<>(params).toString());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class Entry {

        private final JsonStructure value;
        private final long storedAt;

        private Entry(JsonStructure value, long storedAt) {
            this.value = value;
            this.storedAt = storedAt;
        }
    }
}
