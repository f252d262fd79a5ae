package com.schoolsync.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates the HikariCP pool for the directory mirror from environment
 * variables. Falls back to an embedded H2 file database when no Postgres
 * connection is configured.
 */
public final class DataSourceFactory {

    private static final Logger log = LoggerFactory.getLogger(DataSourceFactory.class);

    static final String H2_FALLBACK_URL = "jdbc:h2:file:./data/school;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE";

    private DataSourceFactory() {
    }

    public static HikariDataSource createFromEnv() {
        return createFromEnv(System.getenv());
    }

    public static HikariDataSource createFromEnv(Map<String, String> env) {
        String jdbcUrl = env.get("DB_URL");
        String host = env.get("DB_HOST");
        boolean postgresConfigured = !isBlank(jdbcUrl) || !isBlank(host);

        HikariConfig cfg = new HikariConfig();
        if (!postgresConfigured) {
            log.info("No Postgres configuration found; using embedded H2 database");
            cfg.setJdbcUrl(H2_FALLBACK_URL);
            cfg.setUsername(env.getOrDefault("DB_USER", "sa"));
            cfg.setPassword(env.getOrDefault("DB_PASSWORD", ""));
            cfg.setDriverClassName("org.h2.Driver");
        } else {
            if (isBlank(jdbcUrl)) {
                String port = env.getOrDefault("DB_PORT", "5432");
                String db = env.getOrDefault("DB_NAME", "school");
                jdbcUrl = "jdbc:postgresql://" + host + ":" + port + "/" + db;
            }
            cfg.setJdbcUrl(jdbcUrl);
            cfg.setUsername(env.getOrDefault("DB_USER", "postgres"));
            String pass = env.get("DB_PASSWORD");
            if (pass != null) {
                cfg.setPassword(pass);
            }
            cfg.setDriverClassName("org.postgresql.Driver");
        }
        // The engine is single-threaded; one connection carries the unit of work.
        cfg.setMaximumPoolSize(2);
        cfg.setAutoCommit(true);
        cfg.setPoolName("school-sync-hikari");
        return new HikariDataSource(cfg);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
