package com.schoolsync.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical forms for contact data and person names. Every method returns
 * {@code null} for input it cannot normalize.
 */
public final class DataNormalizer {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    // Test and service accounts the directory exposes alongside real staff.
    private static final List<Pattern> SUSPICIOUS_NAMES = List.of(
            Pattern.compile("^Англ_\\d+"),
            Pattern.compile("^Нем_\\d+"),
            Pattern.compile("^Фр_\\d+"),
            Pattern.compile("^Мат_\\d+"),
            Pattern.compile("^Инф_\\d+"),
            Pattern.compile("^[A-Za-z]+_\\d+"),
            Pattern.compile("^\\d+"),
            Pattern.compile("^[А-Я]{3,5}$"));

    private DataNormalizer() {
        // utility
    }

    /**
     * Reduces a phone number to eleven digits starting with 7.
     */
    public static String normalizePhone(Object raw) {
        if (!(raw instanceof String) || ((String) raw).isEmpty()) {
            return null;
        }
        String digits = NON_DIGITS.matcher((String) raw).replaceAll("");
        if (digits.length() == 11 && digits.startsWith("8")) {
            digits = "7" + digits.substring(1);
        } else if (digits.length() == 10) {
            digits = "7" + digits;
        } else if (!(digits.length() == 11 && digits.startsWith("7"))) {
            return null;
        }
        return digits;
    }

    public static String normalizeEmail(Object raw) {
        if (!(raw instanceof String) || ((String) raw).isEmpty()) {
            return null;
        }
        String cleaned = ((String) raw).trim().toLowerCase(Locale.ROOT);
        return cleaned.contains("@") ? cleaned : null;
    }

    /**
     * Splits a full name in directory order: last name, first name, middle name.
     */
    public static NameParts splitFullName(Object raw) {
        if (!(raw instanceof String)) {
            return NameParts.EMPTY;
        }
        // Unicode separators such as NBSP count as whitespace too.
        List<String> parts = new ArrayList<>(3);
        for (String part : WHITESPACE.split((String) raw)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            return NameParts.EMPTY;
        }
        return new NameParts(
                parts.get(0),
                parts.size() > 1 ? parts.get(1) : null,
                parts.size() > 2 ? parts.get(2) : null);
    }

    public static boolean isSuspiciousName(Object raw) {
        if (!(raw instanceof String) || ((String) raw).isEmpty()) {
            return true;
        }
        String name = (String) raw;
        for (Pattern pattern : SUSPICIOUS_NAMES) {
            if (pattern.matcher(name).lookingAt()) {
                return true;
            }
        }
        return false;
    }
}
