package com.schoolsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schoolsync.service.SyncOrchestrator;
import com.schoolsync.service.SyncReport;
import com.schoolsync.startup.SchemaMigrator;

class SchoolSyncApplicationTest {

    private SchemaMigrator migrator;
    private SyncOrchestrator orchestrator;
    private SyncReport report;

    @BeforeEach
    void setUp() {
        migrator = mock(SchemaMigrator.class);
        orchestrator = mock(SyncOrchestrator.class);
        report = mock(SyncReport.class);
    }

    @Test
    void run_returnsZeroOnSuccess() throws Exception {
        when(orchestrator.run()).thenReturn(report);

        assertEquals(SchoolSyncApplication.EXIT_OK, SchoolSyncApplication.run(migrator, orchestrator));
        verify(migrator).migrate();
    }

    @Test
    void run_reportsInterruption() throws Exception {
        when(report.isInterrupted()).thenReturn(true);
        when(orchestrator.run()).thenReturn(report);

        assertEquals(SchoolSyncApplication.EXIT_INTERRUPTED, SchoolSyncApplication.run(migrator, orchestrator));
    }

    @Test
    void run_failsWhenStoreUnavailable() throws Exception {
        when(orchestrator.run()).thenThrow(new SQLException("connection refused"));

        assertEquals(SchoolSyncApplication.EXIT_FATAL, SchoolSyncApplication.run(migrator, orchestrator));
    }

    @Test
    void run_failsWithoutSyncWhenMigrationFails() throws Exception {
        when(migrator.migrate()).thenThrow(new IllegalStateException("Schema migration failed"));

        assertEquals(SchoolSyncApplication.EXIT_FATAL, SchoolSyncApplication.run(migrator, orchestrator));
        verify(orchestrator, never()).run();
    }
}
