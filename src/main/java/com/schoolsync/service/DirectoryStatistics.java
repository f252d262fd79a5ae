package com.schoolsync.service;

import java.util.Collections;
import java.util.Map;

/**
 * Row counts of the local mirror after a run.
 */
public final class DirectoryStatistics {

    private final int classes;
    private final int staffActive;
    private final int staffTotal;
    private final int staffWithPhone;
    private final int staffWithEmail;
    private final int staffWithExternalId;
    private final Map<String, Integer> staffByType;
    private final int studentsActive;
    private final int studentsTotal;
    private final int parentsActive;
    private final int parentsTotal;
    private final int parentLinks;

    DirectoryStatistics(int classes, int staffActive, int staffTotal, int staffWithPhone, int staffWithEmail,
            int staffWithExternalId, Map<String, Integer> staffByType, int studentsActive, int studentsTotal,
            int parentsActive, int parentsTotal, int parentLinks) {
        this.classes = classes;
        this.staffActive = staffActive;
        this.staffTotal = staffTotal;
        this.staffWithPhone = staffWithPhone;
        this.staffWithEmail = staffWithEmail;
        this.staffWithExternalId = staffWithExternalId;
        this.staffByType = Collections.unmodifiableMap(staffByType);
        this.studentsActive = studentsActive;
        this.studentsTotal = studentsTotal;
        this.parentsActive = parentsActive;
        this.parentsTotal = parentsTotal;
        this.parentLinks = parentLinks;
    }

    public int getClasses() { return classes; }
    public int getStaffActive() { return staffActive; }
    public int getStaffTotal() { return staffTotal; }
    public int getStaffDeactivated() { return staffTotal - staffActive; }
    public int getStaffWithPhone() { return staffWithPhone; }
    public int getStaffWithEmail() { return staffWithEmail; }
    public int getStaffWithExternalId() { return staffWithExternalId; }
    public Map<String, Integer> getStaffByType() { return staffByType; }
    public int getStudentsActive() { return studentsActive; }
    public int getStudentsTotal() { return studentsTotal; }
    public int getParentsActive() { return parentsActive; }
    public int getParentsTotal() { return parentsTotal; }
    public int getParentLinks() { return parentLinks; }
}
