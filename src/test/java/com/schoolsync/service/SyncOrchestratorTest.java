package com.schoolsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.schoolsync.api.RequestCache;
import com.schoolsync.config.SyncConfig;
import com.schoolsync.identity.IdentityResolver;
import com.schoolsync.repo.ClassUnitRepository;

class SyncOrchestratorTest {

    private DataSource dataSource;
    private Connection connection;
    private SnapshotCollaborator snapshots;
    private StaffSyncService staffSync;
    private ClassUnitSyncService classSync;
    private StudentSyncService studentSync;
    private StatisticsService statistics;
    private ClassUnitRepository classUnits;
    private RequestCache cache;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        snapshots = mock(SnapshotCollaborator.class);
        staffSync = mock(StaffSyncService.class);
        classSync = mock(ClassUnitSyncService.class);
        studentSync = mock(StudentSyncService.class);
        statistics = mock(StatisticsService.class);
        classUnits = mock(ClassUnitRepository.class);
        cache = mock(RequestCache.class);

        when(dataSource.getConnection()).thenReturn(connection);
        when(classUnits.findAllIds(connection)).thenReturn(List.of(10L, 20L));
        when(snapshots.createSnapshot()).thenReturn(Optional.empty());
        when(staffSync.sync()).thenReturn(new SyncStats("staff"));
        when(classSync.sync()).thenReturn(new SyncStats("classes"));
        when(studentSync.sync(anyCollection())).thenReturn(new StudentSyncResult());
        when(cache.describeStats()).thenReturn("hits=0, misses=0");
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void run_executesStagesInDependencyOrder() throws Exception {
        when(snapshots.createSnapshot()).thenReturn(Optional.of("snapshot-1"));

        SyncReport report = orchestrator(EnumSet.allOf(SyncConfig.Stage.class)).run();

        InOrder order = inOrder(snapshots, statistics, staffSync, classSync, studentSync);
        order.verify(snapshots).createSnapshot();
        order.verify(statistics).auditStaff();
        order.verify(staffSync).sync();
        order.verify(classSync).sync();
        order.verify(studentSync).sync(List.of(10L, 20L));
        order.verify(statistics).collect();

        assertEquals(List.of("staff", "classes", "students", "parents"),
                report.getStages().stream().map(SyncStats::getStage).toList());
        assertEquals(Optional.of("snapshot-1"), report.getSnapshotHandle());
        assertEquals("hits=0, misses=0", report.getCacheStats());
        assertFalse(report.isInterrupted());
    }

    @Test
    void run_skipsDisabledStages() throws Exception {
        SyncReport report = orchestrator(EnumSet.of(SyncConfig.Stage.STUDENTS)).run();

        verify(staffSync, never()).sync();
        verify(classSync, never()).sync();
        assertTrue(report.getStage("students").isPresent());
        assertTrue(report.getStage("staff").isEmpty());
    }

    @Test
    void run_continuesWhenSnapshotFails() throws Exception {
        when(snapshots.createSnapshot()).thenThrow(new IllegalStateException("disk full"));

        SyncReport report = orchestrator(EnumSet.of(SyncConfig.Stage.STAFF)).run();

        assertTrue(report.getSnapshotHandle().isEmpty());
        verify(staffSync).sync();
    }

    @Test
    void run_interruptionStopsRemainingStages() throws Exception {
        when(classSync.sync()).thenThrow(new InterruptedException());

        SyncReport report = orchestrator(EnumSet.allOf(SyncConfig.Stage.class)).run();

        assertTrue(report.isInterrupted());
        assertTrue(Thread.currentThread().isInterrupted());
        verify(studentSync, never()).sync(anyCollection());
        assertEquals(1, report.getStages().size());
    }

    private SyncOrchestrator orchestrator(EnumSet<SyncConfig.Stage> stages) {
        SyncConfig config = SyncConfig.builder().stages(stages).build();
        return new SyncOrchestrator(config, dataSource, snapshots, staffSync, classSync, studentSync,
                statistics, classUnits, cache, mock(IdentityResolver.class));
    }
}
