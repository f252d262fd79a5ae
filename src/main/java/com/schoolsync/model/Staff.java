package com.schoolsync.model;

import java.time.Instant;

public class Staff extends DirectoryPerson {

    private Long userId;
    private String name;
    private String type;
    private Instant updatedAtApi;

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public Instant getUpdatedAtApi() { return updatedAtApi; }
    public void setUpdatedAtApi(Instant updatedAtApi) { this.updatedAtApi = updatedAtApi; }

    @Override
    public String displayName() {
        return name != null && !name.isBlank() ? name : super.displayName();
    }
}
