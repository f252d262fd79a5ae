package com.schoolsync;

import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.service.SyncOrchestrator;
import com.schoolsync.service.SyncReport;
import com.schoolsync.startup.SchemaMigrator;

import jakarta.enterprise.inject.se.SeContainer;
import jakarta.enterprise.inject.se.SeContainerInitializer;

/**
 * Command line entry point: migrates the schema, then runs one full sync.
 */
public final class SchoolSyncApplication {

    private static final Logger log = LoggerFactory.getLogger(SchoolSyncApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_INTERRUPTED = 130;

    private SchoolSyncApplication() {
    }

    public static void main(String[] args) {
        int status;
        try (SeContainer container = SeContainerInitializer.newInstance().initialize()) {
            status = run(container.select(SchemaMigrator.class).get(),
                    container.select(SyncOrchestrator.class).get());
        } catch (RuntimeException e) {
            log.error("Fatal error during startup", e);
            status = EXIT_FATAL;
        }
        System.exit(status);
    }

    static int run(SchemaMigrator migrator, SyncOrchestrator orchestrator) {
        try {
            migrator.migrate();
            SyncReport report = orchestrator.run();
            return report.isInterrupted() ? EXIT_INTERRUPTED : EXIT_OK;
        } catch (SQLException e) {
            log.error("Directory store unavailable: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (RuntimeException e) {
            log.error("Fatal error during sync", e);
            return EXIT_FATAL;
        }
    }
}
