package com.schoolsync.model;

import java.time.Instant;

/**
 * Class unit; the remote id is also the local primary key.
 */
public class ClassUnit {

    private long id;
    private Long schoolId;
    private Long classLevelId;
    private String name;
    private String parallel;
    private String literal;
    private Instant createdAt;
    private Instant updatedAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public Long getSchoolId() { return schoolId; }
    public void setSchoolId(Long schoolId) { this.schoolId = schoolId; }
    public Long getClassLevelId() { return classLevelId; }
    public void setClassLevelId(Long classLevelId) { this.classLevelId = classLevelId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getParallel() { return parallel; }
    public void setParallel(String parallel) { this.parallel = parallel; }
    public String getLiteral() { return literal; }
    public void setLiteral(String literal) { this.literal = literal; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
