package com.schoolsync.api;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.config.SyncConfig;
import com.schoolsync.time.SyncClock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonArray;

/**
 * Drives paged requests against the directory API. A page shorter than the
 * last-page threshold ends the sequence. A page that still fails after the
 * configured number of attempts, or hitting the page limit, ends it as failed.
 */
@ApplicationScoped
public class PaginatedFetcher {

    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);
    private static final Duration BACKOFF_STEP = Duration.ofSeconds(10);

    private final DirectoryApiClient client;
    private final SyncClock clock;
    private final int maxRetries;
    private final int lastPageThreshold;
    private final int maxPages;
    private final Duration pagePacing;

    @Inject
    public PaginatedFetcher(DirectoryApiClient client, SyncClock clock, SyncConfig config) {
        this(client, clock, config.getFetchMaxRetries(), config.getLastPageThreshold(),
                config.getMaxPages(), config.getPagePacing());
    }

    public PaginatedFetcher(DirectoryApiClient client, SyncClock clock, int maxRetries,
            int lastPageThreshold, int maxPages, Duration pagePacing) {
        this.client = client;
        this.clock = clock;
        this.maxRetries = maxRetries;
        this.lastPageThreshold = lastPageThreshold;
        this.maxPages = maxPages;
        this.pagePacing = pagePacing;
    }

    public PageCursor fetch(String endpoint, Map<String, String> baseParams) {
        return new PageCursor(endpoint, baseParams);
    }

    /**
     * Non-paged request with the same retry policy as a single page.
     */
    public LookupResult<JsonArray> fetchOnce(String endpoint, Map<String, String> params) throws InterruptedException {
        return requestWithRetry(endpoint, params, endpoint);
    }

    private LookupResult<JsonArray> requestWithRetry(String endpoint, Map<String, String> params, String label)
            throws InterruptedException {
        LookupResult<JsonArray> result = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            result = client.get(endpoint, params);
            if (result.isFound()) {
                return result;
            }
            if (attempt < maxRetries) {
                Duration wait = BACKOFF_STEP.multipliedBy(attempt);
                Optional<Duration> retryAfter = result.getRetryAfter();
                if (retryAfter.isPresent() && retryAfter.get().compareTo(wait) > 0) {
                    wait = retryAfter.get();
                }
                log.warn("Failed to load {} ({}), attempt {} of {} in {}s",
                        label, result.getReason(), attempt + 1, maxRetries, wait.toSeconds());
                clock.sleep(wait);
            }
        }
        log.error("Unable to load {} after {} attempts: {}", label, maxRetries, result.getReason());
        return result;
    }

    /**
     * Lazy page sequence. {@link #next()} issues at most one page request.
     */
    public final class PageCursor {

        private final String endpoint;
        private final Map<String, String> baseParams;
        private int nextPage = 1;
        private boolean finished;
        private boolean failed;
        private String failureReason;

        private PageCursor(String endpoint, Map<String, String> baseParams) {
            this.endpoint = endpoint;
            this.baseParams = baseParams == null ? Map.of() : baseParams;
        }

        public Optional<Page> next() throws InterruptedException {
            if (finished) {
                return Optional.empty();
            }
            if (nextPage > maxPages) {
                log.warn("Stopping {} after {} pages; the result is incomplete", endpoint, maxPages);
                finished = true;
                failed = true;
                failureReason = "page limit of " + maxPages + " reached";
                return Optional.empty();
            }
            if (nextPage > 1) {
                clock.sleep(pagePacing);
            }

            Map<String, String> params = new LinkedHashMap<>(baseParams);
            params.put("page", String.valueOf(nextPage));
            LookupResult<JsonArray> result = requestWithRetry(endpoint, params, endpoint + " page " + nextPage);
            if (!result.isFound()) {
                finished = true;
                failed = true;
                failureReason = result.getReason();
                return Optional.empty();
            }

            JsonArray records = result.getValue();
            boolean last = records.size() < lastPageThreshold;
            if (last) {
                log.info("{} page {} is the last page ({} records)", endpoint, nextPage, records.size());
                finished = true;
            }
            return Optional.of(new Page(nextPage++, records, last));
        }

        /**
         * Ends the sequence early without marking it failed.
         */
        public void stop() {
            finished = true;
        }

        public boolean isFailed() {
            return failed;
        }

        public String getFailureReason() {
            return failureReason;
        }

        public int getPagesFetched() {
            return nextPage - 1;
        }
    }
}
