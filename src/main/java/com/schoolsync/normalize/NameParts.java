package com.schoolsync.normalize;

import java.util.Objects;

public final class NameParts {

    public static final NameParts EMPTY = new NameParts(null, null, null);

    private final String lastName;
    private final String firstName;
    private final String middleName;

    public NameParts(String lastName, String firstName, String middleName) {
        this.lastName = lastName;
        this.firstName = firstName;
        this.middleName = middleName;
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

    public boolean isEmpty() {
        return lastName == null && firstName == null && middleName == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NameParts)) {
            return false;
        }
        NameParts other = (NameParts) o;
        return Objects.equals(lastName, other.lastName)
                && Objects.equals(firstName, other.firstName)
                && Objects.equals(middleName, other.middleName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastName, firstName, middleName);
    }

    @Override
    public String toString() {
        return "NameParts{" + lastName + ", " + firstName + ", " + middleName + "}";
    }
}
