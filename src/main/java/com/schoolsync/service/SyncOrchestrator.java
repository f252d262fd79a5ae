package com.schoolsync.service;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.api.RequestCache;
import com.schoolsync.config.SyncConfig;
import com.schoolsync.config.SyncConfig.Stage;
import com.schoolsync.identity.IdentityResolver;
import com.schoolsync.repo.ClassUnitRepository;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Runs the sync stages in dependency order: staff, then classes (which link
 * staff), then the students of every known class.
 */
@ApplicationScoped
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final SyncConfig config;
    private final DataSource dataSource;
    private final SnapshotCollaborator snapshots;
    private final StaffSyncService staffSync;
    private final ClassUnitSyncService classSync;
    private final StudentSyncService studentSync;
    private final StatisticsService statistics;
    private final ClassUnitRepository classUnits;
    private final RequestCache cache;
    private final IdentityResolver identityResolver;

    @Inject
    public SyncOrchestrator(SyncConfig config, DataSource dataSource, SnapshotCollaborator snapshots,
            StaffSyncService staffSync, ClassUnitSyncService classSync, StudentSyncService studentSync,
            StatisticsService statistics, ClassUnitRepository classUnits, RequestCache cache,
            IdentityResolver identityResolver) {
        this.config = config;
        this.dataSource = dataSource;
        this.snapshots = snapshots;
        this.staffSync = staffSync;
        this.classSync = classSync;
        this.studentSync = studentSync;
        this.statistics = statistics;
        this.classUnits = classUnits;
        this.cache = cache;
        this.identityResolver = identityResolver;
    }

    /**
     * Runs every enabled stage. Interruption stops the run after rolling back
     * uncommitted work; the returned report is then marked interrupted and the
     * thread's interrupt flag is set again.
     *
     * @throws SQLException when the store cannot be reached
     */
    public SyncReport run() throws SQLException {
        log.info("Starting directory sync for school {} (stages {})", config.getSchoolId(), config.getStages());
        SyncReport report = new SyncReport();

        takeSnapshot(report);
        report.setStaffAudit(statistics.auditStaff());

        try {
            if (config.isStageEnabled(Stage.STAFF)) {
                report.addStage(staffSync.sync());
            }
            if (config.isStageEnabled(Stage.CLASSES)) {
                report.addStage(classSync.sync());
            }
            if (config.isStageEnabled(Stage.STUDENTS)) {
                List<Long> classIds;
                try (Connection connection = dataSource.getConnection()) {
                    classIds = classUnits.findAllIds(connection);
                }
                StudentSyncResult students = studentSync.sync(classIds);
                report.addStage(students.getStudents());
                report.addStage(students.getParents());
                if (students.getClassesFailed() > 0) {
                    log.warn("{} of {} classes could not be loaded",
                            students.getClassesFailed(), students.getClassesProcessed());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            report.markInterrupted();
            log.warn("Sync interrupted; uncommitted work was rolled back");
        }

        for (SyncStats stage : report.getStages()) {
            log.info("{}", stage);
        }
        report.setStatistics(statistics.collect());
        report.setCacheStats(cache.describeStats());
        log.info("Request cache: {}", report.getCacheStats());
        log.info("Identity cache: {} entries", identityResolver.getMemoizedCount());
        log.info("Directory sync finished with {} errors", report.getTotalErrors());
        return report;
    }

    private void takeSnapshot(SyncReport report) {
        try {
            Optional<String> handle = snapshots.createSnapshot();
            if (handle.isPresent()) {
                report.setSnapshotHandle(handle.get());
                log.info("Snapshot created: {}", handle.get());
            } else {
                log.info("No snapshot taken before sync");
            }
        } catch (RuntimeException e) {
            log.warn("Snapshot failed, continuing without one: {}", e.getMessage());
        }
    }
}
