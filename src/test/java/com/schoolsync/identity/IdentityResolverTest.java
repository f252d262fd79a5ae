package com.schoolsync.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schoolsync.api.LookupResult;
import com.schoolsync.testing.FakeClock;
import com.schoolsync.testing.HttpStubs;

@SuppressWarnings("unchecked")
class IdentityResolverTest {

    private static final String LOOKUP_URL = "https://identity.test/lookup";
    private static final String PROFILE = "https://profiles.test/u/abc";
    private static final String PROFILE_HTML = "<script>var s={data:{user:{id:777001,name:\"T\"}}};</script>";

    private HttpClient httpClient;
    private FakeClock clock;
    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        clock = new FakeClock();
        resolver = new IdentityResolver(httpClient, new RateLimiter(1000, clock), clock, LOOKUP_URL, "token-1");
    }

    @Test
    void resolve_followsLinkAndReadsId() throws Exception {
        HttpResponse<String> lookup = HttpStubs.response(200, "{\"link\":\"" + PROFILE + "\"}");
        HttpResponse<String> page = HttpStubs.response(200, PROFILE_HTML);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(lookup)
                .thenReturn(page);

        LookupResult<ExternalIdentity> result = resolver.resolve(IdentityKind.STAFF, 15);

        assertTrue(result.isFound());
        assertEquals(new ExternalIdentity("777001", PROFILE), result.getValue());
        verify(httpClient).send(argThat(r -> r != null
                && r.uri().toString().equals(LOOKUP_URL + "?staff_id=15")
                && r.headers().firstValue("Authorization").orElse("").equals("Bearer token-1")),
                any(HttpResponse.BodyHandler.class));
        verify(httpClient).send(argThat(r -> r != null && r.uri().toString().equals(PROFILE)
                && r.headers().firstValue("User-Agent").isPresent()),
                any(HttpResponse.BodyHandler.class));
        assertEquals(List.of(IdentityResolver.STAGE_PACING), clock.getSleeps());
    }

    @Test
    void resolve_prefersMaxLink() throws Exception {
        HttpResponse<String> lookup = HttpStubs.response(200,
                "{\"link\":\"https://old.test/x\",\"max_link\":\"" + PROFILE + "\"}");
        HttpResponse<String> page = HttpStubs.response(200, PROFILE_HTML);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(lookup)
                .thenReturn(page);

        LookupResult<ExternalIdentity> result = resolver.resolve(IdentityKind.PERSON, 9);

        assertEquals(PROFILE, result.getValue().getExternalLink());
    }

    @Test
    void resolve_nonSuccessLookupIsNotFoundAndMemoized() throws Exception {
        HttpResponse<String> missing = HttpStubs.response(404, "");
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(missing);

        LookupResult<ExternalIdentity> first = resolver.resolve(IdentityKind.STAFF, 3);
        LookupResult<ExternalIdentity> second = resolver.resolve(IdentityKind.STAFF, 3);

        assertEquals(LookupResult.Status.NOT_FOUND, first.getStatus());
        assertSame(first, second);
        assertEquals(1, resolver.getMemoizedCount());
        verify(httpClient, times(1)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void resolve_pageFailureKeepsLinkWithoutId() throws Exception {
        HttpResponse<String> lookup = HttpStubs.response(200, "{\"link\":\"" + PROFILE + "\"}");
        HttpResponse<String> page = HttpStubs.response(503, "unavailable");
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(lookup)
                .thenReturn(page);

        LookupResult<ExternalIdentity> result = resolver.resolve(IdentityKind.STAFF, 4);

        assertTrue(result.isFound());
        assertNull(result.getValue().getExternalId());
        assertEquals(PROFILE, result.getValue().getExternalLink());
    }

    @Test
    void resolve_rateLimitedLookupWaitsRetryAfter() throws Exception {
        HttpResponse<String> limited = HttpStubs.response(429, "", Map.of("Retry-After", "7"));
        HttpResponse<String> lookup = HttpStubs.response(200, "{\"link\":\"" + PROFILE + "\"}");
        HttpResponse<String> page = HttpStubs.response(200, PROFILE_HTML);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(limited)
                .thenReturn(lookup)
                .thenReturn(page);

        LookupResult<ExternalIdentity> result = resolver.resolve(IdentityKind.STAFF, 5);

        assertEquals("777001", result.getValue().getExternalId());
        assertEquals(List.of(Duration.ofSeconds(7), IdentityResolver.STAGE_PACING), clock.getSleeps());
    }

    @Test
    void resolve_rateLimitedPageRestartsFromLookup() throws Exception {
        HttpResponse<String> lookup = HttpStubs.response(200, "{\"link\":\"" + PROFILE + "\"}");
        HttpResponse<String> limited = HttpStubs.response(429, "", Map.of("Retry-After", "9"));
        HttpResponse<String> page = HttpStubs.response(200, PROFILE_HTML);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(lookup)
                .thenReturn(limited)
                .thenReturn(lookup)
                .thenReturn(page);

        LookupResult<ExternalIdentity> result = resolver.resolve(IdentityKind.STAFF, 12);

        assertTrue(result.isFound());
        assertEquals("777001", result.getValue().getExternalId());
        assertEquals(List.of(IdentityResolver.STAGE_PACING, Duration.ofSeconds(9), IdentityResolver.STAGE_PACING),
                clock.getSleeps());
        verify(httpClient, times(2)).send(argThat(r -> r != null
                && r.uri().toString().equals(LOOKUP_URL + "?staff_id=12")), any(HttpResponse.BodyHandler.class));
        verify(httpClient, times(2)).send(argThat(r -> r != null && r.uri().toString().equals(PROFILE)),
                any(HttpResponse.BodyHandler.class));
    }

    @Test
    void resolve_rateLimitedPageUntilRetriesRunOutIsTransient() throws Exception {
        HttpResponse<String> lookup = HttpStubs.response(200, "{\"link\":\"" + PROFILE + "\"}");
        HttpResponse<String> limited = HttpStubs.response(429, "", Map.of("Retry-After", "9"));
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(lookup)
                .thenReturn(limited)
                .thenReturn(lookup)
                .thenReturn(limited);

        LookupResult<ExternalIdentity> result = resolver.resolve(IdentityKind.STAFF, 13, 2);

        assertEquals(LookupResult.Status.TRANSIENT_FAILURE, result.getStatus());
        assertEquals(0, resolver.getMemoizedCount());
        Duration wait = Duration.ofSeconds(9);
        assertEquals(List.of(IdentityResolver.STAGE_PACING, wait, IdentityResolver.STAGE_PACING, wait),
                clock.getSleeps());
        verify(httpClient, times(4)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    void resolve_networkFailuresAreTransientAndNotMemoized() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("connection reset"));

        LookupResult<ExternalIdentity> result = resolver.resolve(IdentityKind.STAFF, 6, 2);

        assertEquals(LookupResult.Status.TRANSIENT_FAILURE, result.getStatus());
        assertEquals(0, resolver.getMemoizedCount());
        assertEquals(List.of(IdentityResolver.NETWORK_BACKOFF), clock.getSleeps());
    }

    @Test
    void resolve_lookupWithoutLinkIsNotFound() throws Exception {
        HttpResponse<String> lookup = HttpStubs.response(200, "{\"link\":\"\"}");
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(lookup);

        assertEquals(LookupResult.Status.NOT_FOUND, resolver.resolve(IdentityKind.PERSON, 8).getStatus());
    }

    @Test
    void resolveAll_pausesLongerEveryFifthCall() throws Exception {
        HttpResponse<String> missing = HttpStubs.response(404, "");
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(missing);

        Map<Long, LookupResult<ExternalIdentity>> results =
                resolver.resolveAll(IdentityKind.STAFF, List.of(1L, 2L, 3L, 4L, 5L, 6L), 3);

        assertEquals(6, results.size());
        assertFalse(results.get(6L).isFound());
        Duration pace = IdentityResolver.BATCH_PACING;
        assertEquals(List.of(pace, pace, pace, pace, IdentityResolver.BATCH_PAUSE, pace), clock.getSleeps());
    }

    @Test
    void readLink_ignoresNonObjectBodies() {
        assertNull(IdentityResolver.readLink("[1,2]"));
        assertNull(IdentityResolver.readLink("not json"));
        assertEquals(PROFILE, IdentityResolver.readLink("{\"link\":\"" + PROFILE + "\"}"));
    }
}
