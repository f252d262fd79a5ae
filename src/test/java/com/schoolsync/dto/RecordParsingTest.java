package com.schoolsync.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.util.List;

import org.junit.jupiter.api.Test;

import jakarta.json.Json;
import jakarta.json.JsonReader;
import jakarta.json.JsonValue;

class RecordParsingTest {

    @Test
    void staff_readsNestedUserFields() {
        ParsedRecord<StaffRecord> parsed = StaffRecord.parse(json("""
                {"id": 101, "user_id": "5001", "name": "Ivanova Anna Petrovna", "type": "teacher",
                 "updated_at": "2024-08-30 12:00:00", "user_integration_id": 0,
                 "user": {"last_name": "Ivanova", "first_name": "Anna", "phone_number": "+7 900 000-00-01",
                          "email": null, "email_ezd": "a.ivanova@school.test"}}
                """));

        assertTrue(parsed.isAccepted());
        StaffRecord staff = parsed.getRecord();
        assertEquals(101L, staff.getPersonId());
        assertEquals(5001L, staff.getUserId());
        assertEquals("Ivanova", staff.getLastName());
        assertNull(staff.getMiddleName());
        assertNull(staff.getEmail());
        assertEquals("a.ivanova@school.test", staff.getEmailEzd());
        assertNull(staff.getUserIntegrationId());
    }

    @Test
    void staff_rejectsMissingIds() {
        assertEquals(ParsedRecord.Rejection.MISSING_USER_ID,
                StaffRecord.parse(json("{\"id\": 7, \"user_id\": null}")).getRejection());
        assertEquals(ParsedRecord.Rejection.MISSING_ID,
                StaffRecord.parse(json("{\"user_id\": 3}")).getRejection());
        assertEquals(ParsedRecord.Rejection.NOT_AN_OBJECT,
                StaffRecord.parse(json("[1]")).getRejection());
        assertEquals(7L, StaffRecord.peekId(json("{\"id\": 7, \"user_id\": null}")));
    }

    @Test
    void staff_rejectsIdsThatAreNotExactLongs() {
        assertEquals(ParsedRecord.Rejection.MISSING_ID,
                StaffRecord.parse(json("{\"id\": 12.5, \"user_id\": 3}")).getRejection());
        assertEquals(ParsedRecord.Rejection.MISSING_ID,
                StaffRecord.parse(json("{\"id\": 18446744073709551617, \"user_id\": 3}")).getRejection());
        assertEquals(ParsedRecord.Rejection.MISSING_USER_ID,
                StaffRecord.parse(json("{\"id\": 7, \"user_id\": 1e30}")).getRejection());
    }

    @Test
    void rejectedRecordHasNoValue() {
        ParsedRecord<StaffRecord> parsed = StaffRecord.parse(json("{\"id\": -4, \"user_id\": 1}"));

        assertFalse(parsed.isAccepted());
        assertThrows(IllegalStateException.class, parsed::getRecord);
    }

    @Test
    void classUnit_acceptsBareIdsAndSplitsName() {
        ClassUnitRecord bare = ClassUnitRecord.parse(Json.createValue(55)).getRecord();
        assertEquals("Class_55", bare.getName());
        assertFalse(bare.isMentorIdsPresent());

        ClassUnitRecord full = ClassUnitRecord.parse(json("""
                {"id": "12", "name": "5-A", "school_id": 28, "mentor_ids": [101, "102", null]}
                """)).getRecord();
        assertEquals(12L, full.getId());
        assertEquals("5", full.getParallel());
        assertEquals("A", full.getLiteral());
        assertEquals(List.of(101L, 102L), full.getMentorIds());
        assertTrue(full.isMentorIdsPresent());
    }

    @Test
    void classUnit_blankNameFallsBack() {
        ClassUnitRecord unit = ClassUnitRecord.parse(json("{\"id\": 9, \"name\": \" \", \"mentor_ids\": []}"))
                .getRecord();

        assertEquals("Class_9", unit.getName());
        assertNull(unit.getParallel());
        assertTrue(unit.isMentorIdsPresent());
        assertTrue(unit.getMentorIds().isEmpty());
    }

    @Test
    void student_dropsParentsWithoutId() {
        StudentRecord student = StudentRecord.parse(json("""
                {"person_id": 3001, "user_name": "petrov", "last_name": "Petrov",
                 "parents": [{"person_id": 4001, "name": "Petrova Olga"}, {"name": "Unknown"}, "x"]}
                """)).getRecord();

        assertEquals(3001L, student.getPersonId());
        assertEquals(1, student.getParents().size());
        assertEquals(4001L, student.getParents().get(0).getPersonId());
        assertEquals(2, student.getRejectedParents());
    }

    private static JsonValue json(String text) {
        try (JsonReader reader = Json.createReader(new StringReader(text))) {
            return reader.readValue();
        }
    }
}
