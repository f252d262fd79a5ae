package com.schoolsync.service;

/**
 * Counters for one sync stage. Student counters are accumulated across
 * every class of the run.
 */
public final class SyncStats {

    private final String stage;
    private int seen;
    private int saved;
    private int created;
    private int updated;
    private int unchanged;
    private int skippedMissingField;
    private int malformed;
    private int filtered;
    private int duplicates;
    private int errors;
    private int deactivated;
    private int cleaned;
    private int linked;
    private int fetchFailures;
    private int pages;

    public SyncStats(String stage) {
        this.stage = stage;
    }

    void recordSeen() { seen++; }
    void recordCreated() { created++; saved++; }
    void recordUpdated() { updated++; saved++; }
    void recordUnchanged() { unchanged++; saved++; }
    void recordSkippedMissingField() { skippedMissingField++; }
    void recordMalformed() { malformed++; }
    void recordFiltered() { filtered++; }
    void recordDuplicate() { duplicates++; }
    void recordError() { errors++; }
    void recordErrors(int count) { errors += count; }
    void recordDeactivated(int count) { deactivated += count; }
    void recordCleaned(int count) { cleaned += count; }
    void recordLinked(int count) { linked += count; }
    void recordFetchFailure() { fetchFailures++; }
    void recordPage() { pages++; }

    /**
     * Adds the counters of {@code other} to this instance.
     */
    public void add(SyncStats other) {
        seen += other.seen;
        saved += other.saved;
        created += other.created;
        updated += other.updated;
        unchanged += other.unchanged;
        skippedMissingField += other.skippedMissingField;
        malformed += other.malformed;
        filtered += other.filtered;
        duplicates += other.duplicates;
        errors += other.errors;
        deactivated += other.deactivated;
        cleaned += other.cleaned;
        linked += other.linked;
        fetchFailures += other.fetchFailures;
        pages += other.pages;
    }

    public String getStage() { return stage; }
    public int getSeen() { return seen; }
    public int getSaved() { return saved; }
    public int getCreated() { return created; }
    public int getUpdated() { return updated; }
    public int getUnchanged() { return unchanged; }
    public int getSkippedMissingField() { return skippedMissingField; }
    public int getMalformed() { return malformed; }
    public int getFiltered() { return filtered; }
    public int getDuplicates() { return duplicates; }
    public int getErrors() { return errors; }
    public int getDeactivated() { return deactivated; }
    public int getCleaned() { return cleaned; }
    public int getLinked() { return linked; }
    public int getFetchFailures() { return fetchFailures; }
    public int getPages() { return pages; }

    public boolean isFetchFailed() {
        return fetchFailures > 0;
    }

    @Override
    public String toString() {
        return stage + ": seen=" + seen
                + ", saved=" + saved
                + " (created=" + created + ", updated=" + updated + ", unchanged=" + unchanged + ")"
                + ", skipped=" + skippedMissingField
                + ", malformed=" + malformed
                + ", filtered=" + filtered
                + ", duplicates=" + duplicates
                + ", errors=" + errors
                + ", deactivated=" + deactivated
                + ", cleaned=" + cleaned
                + ", linked=" + linked
                + ", fetchFailures=" + fetchFailures;
    }
}
