package com.schoolsync.identity;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.api.LookupResult;
import com.schoolsync.api.RetryAfter;
import com.schoolsync.config.SyncConfig;
import com.schoolsync.time.SyncClock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.Json;
import jakarta.json.JsonException;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;
import jakarta.json.JsonString;
import jakarta.json.JsonStructure;
import jakarta.json.JsonValue;

/**
 * Resolves the external identity of a staff member or person in two stages:
 * the directory's lookup endpoint returns a profile link, and the linked page
 * embeds the numeric id. Results, including "not found", are memoized for the
 * lifetime of the resolver.
 */
@ApplicationScoped
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    static final Duration STAGE_PACING = Duration.ofSeconds(2);
    static final Duration BATCH_PACING = Duration.ofSeconds(2);
    static final Duration BATCH_PAUSE = Duration.ofSeconds(10);
    static final int BATCH_PAUSE_EVERY = 5;
    static final Duration NETWORK_BACKOFF = Duration.ofSeconds(30);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final String BROWSER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    private final Map<String, LookupResult<ExternalIdentity>> memo = new HashMap<>();
    private final HttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final SyncClock clock;
    private final String lookupUrl;
    private final String apiToken;

    @Inject
    public IdentityResolver(HttpClient httpClient, RateLimiter rateLimiter, SyncClock clock, SyncConfig config) {
        this(httpClient, rateLimiter, clock, config.getIdentityApiUrl(), config.getDirectoryApiToken());
    }

    public IdentityResolver(HttpClient httpClient, RateLimiter rateLimiter, SyncClock clock,
            String lookupUrl, String apiToken) {
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.lookupUrl = lookupUrl;
        this.apiToken = apiToken;
    }

    public LookupResult<ExternalIdentity> resolve(IdentityKind kind, long id) throws InterruptedException {
        return resolve(kind, id, DEFAULT_MAX_RETRIES);
    }

    public LookupResult<ExternalIdentity> resolve(IdentityKind kind, long id, int maxRetries)
            throws InterruptedException {
        String key = kind.getQueryParameter() + ":" + id;
        LookupResult<ExternalIdentity> cached = memo.get(key);
        if (cached != null) {
            log.debug("Identity cache HIT for {}", key);
            return cached;
        }

        LookupResult<ExternalIdentity> result = lookup(kind, id, maxRetries);
        if (!result.isTransient()) {
            memo.put(key, result);
        }
        return result;
    }

    /**
     * Resolves a batch of ids with fixed pacing between calls and a longer
     * pause after every fifth call.
     */
    public Map<Long, LookupResult<ExternalIdentity>> resolveAll(IdentityKind kind, Collection<Long> ids,
            int maxRetries) throws InterruptedException {
        Map<Long, LookupResult<ExternalIdentity>> results = new LinkedHashMap<>();
        int total = ids.size();
        log.info("Resolving external identities for {} ids", total);
        int index = 0;
        for (Long id : ids) {
            index++;
            if (index % 10 == 0) {
                log.info("  Progress: {}/{} ({}%)", index, total, String.format("%.1f", index * 100.0 / total));
            }
            results.put(id, resolve(kind, id, maxRetries));
            clock.sleep(index % BATCH_PAUSE_EVERY == 0 ? BATCH_PAUSE : BATCH_PACING);
        }
        log.info("External identity batch complete");
        return results;
    }

    public int getMemoizedCount() {
        return memo.size();
    }

    private LookupResult<ExternalIdentity> lookup(IdentityKind kind, long id, int maxRetries)
            throws InterruptedException {
        URI lookupUri = URI.create(lookupUrl + "?" + kind.getQueryParameter() + "=" + id);
        log.debug("Identity lookup for {}={}", kind.getQueryParameter(), id);

        int attempt = 0;
        while (attempt < maxRetries) {
            rateLimiter.admit();
            HttpResponse<String> response;
            try {
                response = send(lookupRequest(lookupUri));
            } catch (IOException e) {
                attempt++;
                log.debug("Network error on identity lookup for {}: {}", id, e.getMessage());
                if (attempt < maxRetries) {
                    clock.sleep(NETWORK_BACKOFF.multipliedBy(attempt));
                }
                continue;
            }

            if (response.statusCode() == 429) {
                Duration wait = RetryAfter.from(response.headers(), RetryAfter.DEFAULT);
                log.warn("Identity lookup rate limited. Waiting {}s", wait.toSeconds());
                clock.sleep(wait);
                attempt++;
                continue;
            }
            if (response.statusCode() != 200) {
                log.debug("No identity for {}={}: HTTP {}", kind.getQueryParameter(), id, response.statusCode());
                return LookupResult.notFound("HTTP " + response.statusCode());
            }

            String link = readLink(response.body());
            if (link == null) {
                return LookupResult.notFound("no link in lookup response");
            }

            clock.sleep(STAGE_PACING);

            rateLimiter.admit();
            HttpResponse<String> page;
            try {
                page = send(pageRequest(link));
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Unable to load identity page {}: {}", link, e.getMessage());
                return LookupResult.found(new ExternalIdentity(null, link));
            }

            if (page.statusCode() == 200) {
                String externalId = IdentityPageParser.extractUserId(page.body());
                if (externalId == null) {
                    log.debug("Identity page for {} has no user id", id);
                } else {
                    log.debug("Resolved external id {} for {}={}", externalId, kind.getQueryParameter(), id);
                }
                return LookupResult.found(new ExternalIdentity(externalId, link));
            }
            if (page.statusCode() == 429) {
                Duration wait = RetryAfter.from(page.headers(), RetryAfter.DEFAULT);
                log.warn("Identity page rate limited. Waiting {}s", wait.toSeconds());
                clock.sleep(wait);
                attempt++;
                continue;
            }
            log.debug("Identity page returned HTTP {} for {}", page.statusCode(), id);
            return LookupResult.found(new ExternalIdentity(null, link));
        }

        log.warn("Identity lookup for {}={} failed after {} attempts", kind.getQueryParameter(), id, maxRetries);
        return LookupResult.transientFailure("retries exhausted");
    }

    private HttpRequest lookupRequest(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET();
        if (apiToken != null && !apiToken.isBlank()) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        return builder.build();
    }

    private HttpRequest pageRequest(String link) {
        return HttpRequest.newBuilder(URI.create(link))
                .timeout(REQUEST_TIMEOUT)
                .header("User-Agent", BROWSER_AGENT)
                .GET()
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    static String readLink(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try (JsonReader reader = Json.createReader(new StringReader(body))) {
            JsonStructure root = reader.read();
            if (root.getValueType() != JsonValue.ValueType.OBJECT) {
                return null;
            }
            JsonObject obj = root.asJsonObject();
            for (String field : new String[]{"max_link", "link"}) {
                JsonValue value = obj.get(field);
                if (value instanceof JsonString js && !js.getString().isBlank()) {
                    return js.getString();
                }
            }
            return null;
        } catch (JsonException e) {
            log.debug("Identity lookup returned invalid JSON: {}", e.getMessage());
            return null;
        }
    }
}
