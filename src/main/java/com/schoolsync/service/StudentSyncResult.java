package com.schoolsync.service;

/**
 * Student counters for every class of a run, with the parents upserted
 * along the way.
 */
public final class StudentSyncResult {

    private final SyncStats students;
    private final SyncStats parents;
    private int classesProcessed;
    private int classesFailed;

    StudentSyncResult() {
        this(new SyncStats("students"), new SyncStats("parents"));
    }

    StudentSyncResult(SyncStats students, SyncStats parents) {
        this.students = students;
        this.parents = parents;
    }

    void recordClass(boolean fetchFailed) {
        classesProcessed++;
        if (fetchFailed) {
            classesFailed++;
        }
    }

    public SyncStats getStudents() {
        return students;
    }

    public SyncStats getParents() {
        return parents;
    }

    public int getClassesProcessed() {
        return classesProcessed;
    }

    public int getClassesFailed() {
        return classesFailed;
    }
}
