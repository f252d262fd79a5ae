package com.schoolsync.identity;

/**
 * Which query parameter selects the person on the identity lookup endpoint.
 */
public enum IdentityKind {

    STAFF("staff_id"),
    PERSON("person_id");

    private final String queryParameter;

    IdentityKind(String queryParameter) {
        this.queryParameter = queryParameter;
    }

    public String getQueryParameter() {
        return queryParameter;
    }
}
