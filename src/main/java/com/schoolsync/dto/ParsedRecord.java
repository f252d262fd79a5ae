package com.schoolsync.dto;

/**
 * A directory record that either passed boundary validation or was rejected
 * for a known reason.
 */
public final class ParsedRecord<T> {

    public enum Rejection {
        NOT_AN_OBJECT,
        MISSING_ID,
        MISSING_USER_ID
    }

    private final T record;
    private final Rejection rejection;

    private ParsedRecord(T record, Rejection rejection) {
        this.record = record;
        this.rejection = rejection;
    }

    static <T> ParsedRecord<T> accepted(T record) {
        return new ParsedRecord<>(record, null);
    }

    static <T> ParsedRecord<T> rejected(Rejection rejection) {
        return new ParsedRecord<>(null, rejection);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public T getRecord() {
        if (rejection != null) {
            throw new IllegalStateException("Record was rejected: " + rejection);
        }
        return record;
    }

    public Rejection getRejection() {
        return rejection;
    }
}
