package com.schoolsync.dto;

import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

/**
 * Parent entry nested in a student profile.
 */
public final class ParentRecord {

    private final long personId;
    private final String name;
    private final String phoneNumber;
    private final String email;

    private ParentRecord(long personId, String name, String phoneNumber, String email) {
        this.personId = personId;
        this.name = name;
        this.phoneNumber = phoneNumber;
        this.email = email;
    }

    public static ParsedRecord<ParentRecord> parse(JsonValue value) {
        if (!(value instanceof JsonObject source)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.NOT_AN_OBJECT);
        }
        Long personId = JsonValues.getLong(source, "person_id");
        if (!JsonValues.isValidId(personId)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.MISSING_ID);
        }
        return ParsedRecord.accepted(new ParentRecord(
                personId,
                JsonValues.getString(source, "name"),
                JsonValues.getString(source, "phone_number"),
                JsonValues.getString(source, "email")));
    }

    public long getPersonId() {
        return personId;
    }

    public String getName() {
        return name;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getEmail() {
        return email;
    }
}
