package com.schoolsync.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one orchestrated run.
 */
public final class SyncReport {

    private final List<SyncStats> stages = new ArrayList<>();
    private String snapshotHandle;
    private StaffAudit staffAudit;
    private DirectoryStatistics statistics;
    private String cacheStats;
    private boolean interrupted;

    void addStage(SyncStats stats) {
        stages.add(stats);
    }

    void setSnapshotHandle(String snapshotHandle) {
        this.snapshotHandle = snapshotHandle;
    }

    void setStaffAudit(StaffAudit staffAudit) {
        this.staffAudit = staffAudit;
    }

    void setStatistics(DirectoryStatistics statistics) {
        this.statistics = statistics;
    }

    void setCacheStats(String cacheStats) {
        this.cacheStats = cacheStats;
    }

    void markInterrupted() {
        this.interrupted = true;
    }

    public List<SyncStats> getStages() {
        return Collections.unmodifiableList(stages);
    }

    public Optional<SyncStats> getStage(String name) {
        return stages.stream().filter(s -> s.getStage().equals(name)).findFirst();
    }

    public Optional<String> getSnapshotHandle() {
        return Optional.ofNullable(snapshotHandle);
    }

    public Optional<StaffAudit> getStaffAudit() {
        return Optional.ofNullable(staffAudit);
    }

    public Optional<DirectoryStatistics> getStatistics() {
        return Optional.ofNullable(statistics);
    }

    public String getCacheStats() {
        return cacheStats;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public int getTotalErrors() {
        return stages.stream().mapToInt(SyncStats::getErrors).sum();
    }
}
