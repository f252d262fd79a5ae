package com.schoolsync.model;

public class Parent extends DirectoryPerson {

    private String name;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    @Override
    public String displayName() {
        return name != null && !name.isBlank() ? name : super.displayName();
    }
}
