package com.schoolsync.api;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.config.SyncConfig;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonException;
import jakarta.json.JsonReader;
import jakarta.json.JsonStructure;
import jakarta.json.JsonValue;

/**
 * Single GET against the primary directory API. Successful array responses
 * are written through the {@link RequestCache}.
 */
@ApplicationScoped
public class DirectoryApiClient {

    private static final Logger log = LoggerFactory.getLogger(DirectoryApiClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final SyncConfig config;
    private final RequestCache cache;

    @Inject
    public DirectoryApiClient(HttpClient httpClient, SyncConfig config, RequestCache cache) {
        this.httpClient = httpClient;
        this.config = config;
        this.cache = cache;
    }

    public LookupResult<JsonArray> get(String endpoint, Map<String, String> params) throws InterruptedException {
        Optional<JsonStructure> cached = cache.get(endpoint, params);
        if (cached.isPresent() && cached.get().getValueType() == JsonValue.ValueType.ARRAY) {
            return LookupResult.found(cached.get().asJsonArray());
        }

        URI uri = buildUri(endpoint, params);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET();
        String token = config.getDirectoryApiToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        String profileId = config.getDirectoryProfileId();
        if (profileId != null && !profileId.isBlank()) {
            builder.header("profile-id", profileId);
        }

        HttpResponse<String> response;
        try {
            log.debug("Directory API request: {}", uri);
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Network error requesting {}: {}", uri, e.getMessage());
            return LookupResult.transientFailure("network error: " + e.getMessage());
        }

        int status = response.statusCode();
        if (status == 429) {
            Duration retryAfter = RetryAfter.from(response.headers(), RetryAfter.DEFAULT);
            log.warn("Directory API rate limit on {}; Retry-After {}s", endpoint, retryAfter.toSeconds());
            return LookupResult.transientFailure("HTTP 429", retryAfter);
        }
        if (status != 200) {
            log.error("Directory API returned {} for {}", status, uri);
            return LookupResult.permanentFailure("HTTP " + status);
        }

        JsonStructure root;
        try (JsonReader reader = Json.createReader(new StringReader(response.body() == null ? "" : response.body()))) {
            root = reader.read();
        } catch (JsonException e) {
            log.error("Invalid JSON from {}: {}", uri, truncateBody(response.body()));
            return LookupResult.permanentFailure("invalid JSON: " + e.getMessage());
        }
        if (root.getValueType() != JsonValue.ValueType.ARRAY) {
            log.warn("Directory API returned {} instead of an array for {}", root.getValueType(), endpoint);
            return LookupResult.permanentFailure("expected JSON array, got " + root.getValueType());
        }

        JsonArray array = root.asJsonArray();
        cache.set(endpoint, params, array);
        log.debug("Received {} records from {}", array.size(), endpoint);
        return LookupResult.found(array);
    }

    URI buildUri(String endpoint, Map<String, String> params) {
        String base = config.getDirectoryApiUrl() + "/" + endpoint;
        if (params == null || params.isEmpty()) {
            return URI.create(base);
        }
        String query = params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return URI.create(base + "?" + query);
    }

    private String truncateBody(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 512 ? body.substring(0, 512) + "..." : body;
    }
}
