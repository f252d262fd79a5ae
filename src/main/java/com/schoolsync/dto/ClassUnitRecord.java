package com.schoolsync.dto;

import java.util.Collections;
import java.util.List;

import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

/**
 * Class unit from {@code class_units}. The endpoint may return bare ids
 * instead of objects; those become a unit named {@code Class_<id>}.
 */
public final class ClassUnitRecord {

    private final long id;
    private final String name;
    private final Long schoolId;
    private final Long classLevelId;
    private final List<Long> mentorIds;
    private final boolean mentorIdsPresent;

    private ClassUnitRecord(long id, String name, Long schoolId, Long classLevelId,
            List<Long> mentorIds, boolean mentorIdsPresent) {
        this.id = id;
        this.name = name;
        this.schoolId = schoolId;
        this.classLevelId = classLevelId;
        this.mentorIds = Collections.unmodifiableList(mentorIds);
        this.mentorIdsPresent = mentorIdsPresent;
    }

    public static ParsedRecord<ClassUnitRecord> parse(JsonValue value) {
        if (value instanceof JsonNumber || value instanceof JsonString) {
            Long bareId = JsonValues.toLong(value);
            if (!JsonValues.isValidId(bareId)) {
                return ParsedRecord.rejected(ParsedRecord.Rejection.MISSING_ID);
            }
            return ParsedRecord.accepted(new ClassUnitRecord(bareId, "Class_" + bareId, null, null, List.of(), false));
        }
        if (!(value instanceof JsonObject source)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.NOT_AN_OBJECT);
        }
        Long id = JsonValues.getLong(source, "id");
        if (!JsonValues.isValidId(id)) {
            return ParsedRecord.rejected(ParsedRecord.Rejection.MISSING_ID);
        }
        String name = JsonValues.getString(source, "name");
        if (name == null || name.isBlank()) {
            name = "Class_" + id;
        }
        return ParsedRecord.accepted(new ClassUnitRecord(
                id,
                name,
                JsonValues.getLong(source, "school_id"),
                JsonValues.getLong(source, "class_level_id"),
                JsonValues.getLongList(source, "mentor_ids"),
                JsonValues.getArray(source, "mentor_ids") != null));
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Part before the dash in names like {@code 5-А}.
     */
    public String getParallel() {
        int dash = name.indexOf('-');
        return dash < 0 ? null : name.substring(0, dash);
    }

    /**
     * Part after the first dash, up to the next one.
     */
    public String getLiteral() {
        int dash = name.indexOf('-');
        if (dash < 0) {
            return null;
        }
        String rest = name.substring(dash + 1);
        int next = rest.indexOf('-');
        return next < 0 ? rest : rest.substring(0, next);
    }

    public Long getSchoolId() {
        return schoolId;
    }

    public Long getClassLevelId() {
        return classLevelId;
    }

    public List<Long> getMentorIds() {
        return mentorIds;
    }

    public boolean isMentorIdsPresent() {
        return mentorIdsPresent;
    }
}
