package com.schoolsync.api;

import jakarta.json.JsonArray;

public final class Page {

    private final int number;
    private final JsonArray records;
    private final boolean last;

    public Page(int number, JsonArray records, boolean last) {
        this.number = number;
        this.records = records;
        this.last = last;
    }

    public int getNumber() {
        return number;
    }

    public JsonArray getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isLast() {
        return last;
    }
}
