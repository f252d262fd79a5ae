package com.schoolsync.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Run configuration read from environment variables. Credentials for the
 * directory API are supplied externally and are never validated here.
 */
public final class SyncConfig {

    public enum Stage {
        STAFF, CLASSES, STUDENTS
    }

    static final String DEFAULT_DIRECTORY_URL = "https://school.mos.ru/api/ej/core/teacher/v1";
    static final String DEFAULT_IDENTITY_URL = "https://school.mos.ru/v2/external-partners/check-for-max-user";

    private final long schoolId;
    private final String directoryApiUrl;
    private final String directoryApiToken;
    private final String directoryProfileId;
    private final String identityApiUrl;
    private final int identityRateLimit;
    private final int identityMaxRetries;
    private final int fetchMaxRetries;
    private final Duration cacheTtl;
    private final int lastPageThreshold;
    private final int maxPages;
    private final Duration recordPacing;
    private final Duration pagePacing;
    private final Set<Stage> stages;

    private SyncConfig(Builder builder) {
        this.schoolId = builder.schoolId;
        this.directoryApiUrl = stripTrailingSlash(builder.directoryApiUrl);
        this.directoryApiToken = builder.directoryApiToken;
        this.directoryProfileId = builder.directoryProfileId;
        this.identityApiUrl = builder.identityApiUrl;
        this.identityRateLimit = builder.identityRateLimit;
        this.identityMaxRetries = builder.identityMaxRetries;
        this.fetchMaxRetries = builder.fetchMaxRetries;
        this.cacheTtl = builder.cacheTtl;
        this.lastPageThreshold = builder.lastPageThreshold;
        this.maxPages = builder.maxPages;
        this.recordPacing = builder.recordPacing;
        this.pagePacing = builder.pagePacing;
        this.stages = Collections.unmodifiableSet(EnumSet.copyOf(builder.stages));
    }

    public static SyncConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static SyncConfig fromEnv(Map<String, String> env) {
        Builder builder = builder();
        builder.schoolId(longValue(env, "SCHOOL_ID", 28L));
        builder.directoryApiUrl(env.getOrDefault("DIRECTORY_API_URL", DEFAULT_DIRECTORY_URL));
        builder.directoryApiToken(blankToNull(env.get("DIRECTORY_API_TOKEN")));
        builder.directoryProfileId(blankToNull(env.get("DIRECTORY_API_PROFILE_ID")));
        builder.identityApiUrl(env.getOrDefault("IDENTITY_API_URL", DEFAULT_IDENTITY_URL));
        builder.identityRateLimit(intValue(env, "IDENTITY_RATE_LIMIT", 100));
        builder.identityMaxRetries(intValue(env, "IDENTITY_MAX_RETRIES", 2));
        builder.fetchMaxRetries(intValue(env, "FETCH_MAX_RETRIES", 3));
        builder.cacheTtl(Duration.ofSeconds(longValue(env, "CACHE_TTL_SECONDS", 300L)));
        builder.lastPageThreshold(intValue(env, "LAST_PAGE_THRESHOLD", 10));
        builder.maxPages(intValue(env, "MAX_PAGES", 500));
        builder.recordPacing(Duration.ofMillis(longValue(env, "RECORD_PACING_MILLIS", 1000L)));
        builder.pagePacing(Duration.ofMillis(longValue(env, "PAGE_PACING_MILLIS", 1000L)));
        String stages = env.get("SYNC_STAGES");
        if (stages != null && !stages.isBlank()) {
            builder.stages(parseStages(stages));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getSchoolId() {
        return schoolId;
    }

    public String getDirectoryApiUrl() {
        return directoryApiUrl;
    }

    public String getDirectoryApiToken() {
        return directoryApiToken;
    }

    public String getDirectoryProfileId() {
        return directoryProfileId;
    }

    public String getIdentityApiUrl() {
        return identityApiUrl;
    }

    public int getIdentityRateLimit() {
        return identityRateLimit;
    }

    public int getIdentityMaxRetries() {
        return identityMaxRetries;
    }

    public int getFetchMaxRetries() {
        return fetchMaxRetries;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public int getLastPageThreshold() {
        return lastPageThreshold;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public Duration getRecordPacing() {
        return recordPacing;
    }

    public Duration getPagePacing() {
        return pagePacing;
    }

    public Set<Stage> getStages() {
        return stages;
    }

    public boolean isStageEnabled(Stage stage) {
        return stages.contains(stage);
    }

    static Set<Stage> parseStages(String value) {
        EnumSet<Stage> parsed = EnumSet.noneOf(Stage.class);
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(s -> {
                    try {
                        parsed.add(Stage.valueOf(s.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalStateException("Unknown sync stage '" + s + "' in SYNC_STAGES", e);
                    }
                });
        if (parsed.isEmpty()) {
            throw new IllegalStateException("SYNC_STAGES must name at least one stage");
        }
        return parsed;
    }

    private static int intValue(Map<String, String> env, String name, int fallback) {
        return (int) longValue(env, name, fallback);
    }

    private static long longValue(Map<String, String> env, String name, long fallback) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Environment variable " + name + " must be numeric, got '" + value + "'", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String stripTrailingSlash(String url) {
        return url == null ? null : url.replaceAll("/+$", "");
    }

    public static final class Builder {

        private long schoolId = 28L;
        private String directoryApiUrl = DEFAULT_DIRECTORY_URL;
        private String directoryApiToken;
        private String directoryProfileId;
        private String identityApiUrl = DEFAULT_IDENTITY_URL;
        private int identityRateLimit = 100;
        private int identityMaxRetries = 2;
        private int fetchMaxRetries = 3;
        private Duration cacheTtl = Duration.ofSeconds(300);
        private int lastPageThreshold = 10;
        private int maxPages = 500;
        private Duration recordPacing = Duration.ofSeconds(1);
        private Duration pagePacing = Duration.ofSeconds(1);
        private Set<Stage> stages = EnumSet.allOf(Stage.class);

        private Builder() {
        }

        public Builder schoolId(long schoolId) {
            this.schoolId = schoolId;
            return this;
        }

        public Builder directoryApiUrl(String directoryApiUrl) {
            this.directoryApiUrl = directoryApiUrl;
            return this;
        }

        public Builder directoryApiToken(String directoryApiToken) {
            this.directoryApiToken = directoryApiToken;
            return this;
        }

        public Builder directoryProfileId(String directoryProfileId) {
            this.directoryProfileId = directoryProfileId;
            return this;
        }

        public Builder identityApiUrl(String identityApiUrl) {
            this.identityApiUrl = identityApiUrl;
            return this;
        }

        public Builder identityRateLimit(int identityRateLimit) {
            this.identityRateLimit = identityRateLimit;
            return this;
        }

        public Builder identityMaxRetries(int identityMaxRetries) {
            this.identityMaxRetries = identityMaxRetries;
            return this;
        }

        public Builder fetchMaxRetries(int fetchMaxRetries) {
            this.fetchMaxRetries = fetchMaxRetries;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder lastPageThreshold(int lastPageThreshold) {
            this.lastPageThreshold = lastPageThreshold;
            return this;
        }

        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Builder recordPacing(Duration recordPacing) {
            this.recordPacing = recordPacing;
            return this;
        }

        public Builder pagePacing(Duration pagePacing) {
            this.pagePacing = pagePacing;
            return this;
        }

        public Builder stages(Set<Stage> stages) {
            this.stages = stages;
            return this;
        }

        public SyncConfig build() {
            if (identityRateLimit <= 10) {
                throw new IllegalStateException("IDENTITY_RATE_LIMIT must be greater than 10");
            }
            if (fetchMaxRetries < 1 || identityMaxRetries < 1) {
                throw new IllegalStateException("Retry counts must be at least 1");
            }
            if (stages == null || stages.isEmpty()) {
                throw new IllegalStateException("At least one sync stage is required");
            }
            return new SyncConfig(this);
        }
    }
}
