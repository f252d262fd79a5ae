package com.schoolsync.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.schoolsync.model.DirectoryPerson;

/**
 * Applies incoming directory values to an existing row: a non-empty incoming
 * value replaces the stored one, an empty one keeps it. Records the names of
 * the fields whose value actually changed.
 */
final class FieldMerger {

    private final List<String> changed = new ArrayList<>();

    String merge(String field, String existing, String incoming) {
        if (incoming == null || incoming.isBlank()) {
            return existing;
        }
        if (!incoming.equals(existing)) {
            changed.add(field);
        }
        return incoming;
    }

    <T> T merge(String field, T existing, T incoming) {
        if (incoming == null) {
            return existing;
        }
        if (!Objects.equals(existing, incoming)) {
            changed.add(field);
        }
        return incoming;
    }

    /**
     * Merges the columns every person table shares, then marks the row as
     * seen. A reactivated row counts as changed.
     */
    void mergePerson(DirectoryPerson existing, DirectoryPerson incoming, Instant now) {
        existing.setLastName(merge("last_name", existing.getLastName(), incoming.getLastName()));
        existing.setFirstName(merge("first_name", existing.getFirstName(), incoming.getFirstName()));
        existing.setMiddleName(merge("middle_name", existing.getMiddleName(), incoming.getMiddleName()));
        existing.setEmail(merge("email", existing.getEmail(), incoming.getEmail()));
        existing.setPhone(merge("phone", existing.getPhone(), incoming.getPhone()));
        existing.setExternalId(merge("external_id", existing.getExternalId(), incoming.getExternalId()));
        existing.setExternalLink(merge("external_link", existing.getExternalLink(), incoming.getExternalLink()));
        if (!existing.isActive()) {
            flag("is_active");
        }
        existing.markSeen(now);
    }

    void flag(String field) {
        changed.add(field);
    }

    boolean hasChanges() {
        return !changed.isEmpty();
    }

    List<String> getChangedFields() {
        return Collections.unmodifiableList(changed);
    }
}
