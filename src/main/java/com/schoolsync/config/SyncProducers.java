package com.schoolsync.config;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.service.SnapshotCollaborator;
import com.schoolsync.time.SyncClock;
import com.schoolsync.time.SystemSyncClock;
import com.zaxxer.hikari.HikariDataSource;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Infrastructure the sync beans depend on.
 */
@ApplicationScoped
public class SyncProducers {

    private static final Logger log = LoggerFactory.getLogger(SyncProducers.class);

    @Produces
    @Singleton
    public SyncConfig syncConfig() {
        return SyncConfig.fromEnv();
    }

    @Produces
    @Singleton
    public DataSource dataSource() {
        return DataSourceFactory.createFromEnv();
    }

    public void closeDataSource(@Disposes DataSource dataSource) {
        if (dataSource instanceof HikariDataSource hikari) {
            log.info("Closing connection pool {}", hikari.getPoolName());
            hikari.close();
        }
    }

    @Produces
    @Singleton
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Produces
    @Singleton
    public SyncClock syncClock() {
        return new SystemSyncClock();
    }

    /**
     * Backups are managed outside this process.
     */
    @Produces
    @Singleton
    public SnapshotCollaborator snapshotCollaborator() {
        return Optional::empty;
    }
}
