package com.schoolsync.service;

/**
 * Data quality counts for the staff table, taken before a run.
 */
public final class StaffAudit {

    private final int withoutUserId;
    private final int withoutName;
    private final int withoutContacts;

    StaffAudit(int withoutUserId, int withoutName, int withoutContacts) {
        this.withoutUserId = withoutUserId;
        this.withoutName = withoutName;
        this.withoutContacts = withoutContacts;
    }

    public int getWithoutUserId() {
        return withoutUserId;
    }

    public int getWithoutName() {
        return withoutName;
    }

    public int getWithoutContacts() {
        return withoutContacts;
    }
}
