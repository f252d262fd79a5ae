package com.schoolsync.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.json.JsonArray;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

/**
 * Student profile from {@code student_profiles}, with its parents already
 * validated. Parents without a usable {@code person_id} are dropped and
 * counted in {@link #getRejectedParents()}.
 */
public final class StudentRecord {

    private final long personId;
    private final String userName;
    private final String lastName;
    private final String firstName;
    private final String middleName;
    private final String phoneNumber;
    private final String emailEzd;
    private final List<ParentRecord> parents;
    private final int rejectedParents;

    private StudentRecord(long personId, JsonObject source, List<ParentRecord> parents, int rejectedParents) {
        this.personId = personId;
        this.userName = JsonValues.getString(source, "user_name");
        this.lastName = JsonValues.getString(source, "last_name");
        this.firstName = JsonValues.getString(source, "first_name");
        this.middleName = JsonValues.getString(source, "middle_name");
        this.phoneNumber = JsonValues.getString(source, "phone_number");
        this.emailEzd = JsonValues.getString(source, "email_ezd");
        this.parents = Collections.unmodifiableList(parents);
        this.rejectedParents = rejectedParents;
    }

    public static ParsedRecord<StudentRecord> parse(JsonValue value) {
        if (!(value instanceof JsonObject source)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.NOT_AN_OBJECT);
        }
        Long personId = JsonValues.getLong(source, "person_id");
        if (!JsonValues.isValidId(personId)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.MISSING_ID);
        }

        List<ParentRecord> parents = new ArrayList<>();
        int rejected = 0;
        JsonArray rawParents = JsonValues.getArray(source, "parents");
        if (rawParents != null) {
            for (JsonValue rawParent : rawParents) {
                ParsedRecord<ParentRecord> parsed = ParentRecord.parse(rawParent);
                if (parsed.isAccepted()) {
                    parents.add(parsed.getRecord());
                } else {
                    rejected++;
                }
            }
        }
        return ParsedRecord.accepted(new StudentRecord(personId, source, parents, rejected));
    }

    public static Long peekId(JsonValue value) {
        return value instanceof JsonObject source ? JsonValues.getLong(source, "person_id") : null;
    }

    public long getPersonId() {
        return personId;
    }

    public String getUserName() {
        return userName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getMiddleName() {
        return middleName;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getEmailEzd() {
        return emailEzd;
    }

    public List<ParentRecord> getParents() {
        return parents;
    }

    public int getRejectedParents() {
        return rejectedParents;
    }
}
