package com.schoolsync.dto;

import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

/**
 * Staff profile as returned by {@code teacher_profiles}. Contact and name
 * fields come from the nested {@code user} object.
 */
public final class StaffRecord {

    private final long personId;
    private final long userId;
    private final String fullName;
    private final String lastName;
    private final String firstName;
    private final String middleName;
    private final String phoneNumber;
    private final String email;
    private final String emailEzd;
    private final String type;
    private final String updatedAt;
    private final Long userIntegrationId;

    private StaffRecord(long personId, long userId, JsonObject source, JsonObject user) {
        this.personId = personId;
        this.userId = userId;
        this.fullName = JsonValues.getString(source, "name");
        this.lastName = JsonValues.getString(user, "last_name");
        this.firstName = JsonValues.getString(user, "first_name");
        this.middleName = JsonValues.getString(user, "middle_name");
        this.phoneNumber = JsonValues.getString(user, "phone_number");
        this.email = JsonValues.getString(user, "email");
        this.emailEzd = JsonValues.getString(user, "email_ezd");
        this.type = JsonValues.getString(source, "type");
        this.updatedAt = JsonValues.getString(source, "updated_at");
        Long integrationId = JsonValues.getLong(source, "user_integration_id");
        this.userIntegrationId = JsonValues.isValidId(integrationId) ? integrationId : null;
    }

    public static ParsedRecord<StaffRecord> parse(JsonValue value) {
        if (!(value instanceof JsonObject source)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.NOT_AN_OBJECT);
        }
        Long personId = JsonValues.getLong(source, "id");
        if (!JsonValues.isValidId(personId)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.MISSING_ID);
        }
        Long userId = JsonValues.getLong(source, "user_id");
        if (!JsonValues.isValidId(userId)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.MISSING_USER_ID);
        }
        return ParsedRecord.accepted(new StaffRecord(personId, userId, source, JsonValues.getObject(source, "user")));
    }

    /**
     * Remote id of the raw record, when it has one, so that rejected records
     * can still be reported.
     */
    public static Long peekId(JsonValue value) {
        return value instanceof JsonObject source ? JsonValues.getLong(source, "id") : null;
    }

    public long getPersonId() {
        return personId;
    }

    public long getUserId() {
        return userId;
    }

    public String getFullName() {
        return fullName;
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

    public String getEmail() {
        return email;
    }

    public String getEmailEzd() {
        return emailEzd;
    }

    public String getType() {
        return type;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public Long getUserIntegrationId() {
        return userIntegrationId;
    }
}
