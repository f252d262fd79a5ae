package com.schoolsync.dto;

import java.util.ArrayList;
import java.util.List;

import jakarta.json.JsonArray;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

/**
 * Lenient accessors for directory payloads, where numbers sometimes arrive as
 * strings and absent values as {@code null}.
 */
final class JsonValues {

    private JsonValues() {
    }

    static String getString(JsonObject source, String key) {
        if (source == null || key == null || !source.containsKey(key)) {
            return null;
        }
        JsonValue value = source.get(key);
        if (value == null || value == JsonValue.NULL) {
            return null;
        }
        if (value instanceof JsonString js) {
            return js.getString();
        }
        if (value instanceof JsonNumber number) {
            return number.toString();
        }
        return null;
    }

    static Long getLong(JsonObject source, String key) {
        if (source == null || !source.containsKey(key)) {
            return null;
        }
        return toLong(source.get(key));
    }

    static Long toLong(JsonValue value) {
        if (value instanceof JsonNumber number) {
            try {
                return number.longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        if (value instanceof JsonString js) {
            try {
                return Long.parseLong(js.getString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static JsonObject getObject(JsonObject source, String key) {
        if (source == null || !source.containsKey(key)) {
            return null;
        }
        JsonValue value = source.get(key);
        return value instanceof JsonObject obj ? obj : null;
    }

    static JsonArray getArray(JsonObject source, String key) {
        if (source == null || !source.containsKey(key)) {
            return null;
        }
        JsonValue value = source.get(key);
        return value instanceof JsonArray array ? array : null;
    }

    static List<Long> getLongList(JsonObject source, String key) {
        JsonArray array = getArray(source, key);
        List<Long> ids = new ArrayList<>();
        if (array == null) {
            return ids;
        }
        for (JsonValue value : array) {
            Long id = toLong(value);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * Positive ids only; zero and negatives never identify a directory record.
     */
    static boolean isValidId(Long id) {
        return id != null && id > 0;
    }
}
