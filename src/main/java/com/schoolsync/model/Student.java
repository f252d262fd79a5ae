package com.schoolsync.model;

public class Student extends DirectoryPerson {

    private String userName;
    private Long classUnitId;

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }
    public Long getClassUnitId() { return classUnitId; }
    public void setClassUnitId(Long classUnitId) { this.classUnitId = classUnitId; }
}
