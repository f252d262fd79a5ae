package com.schoolsync.identity;

import java.util.Objects;

/**
 * Secondary identity of a person. The link is always known; the numeric id
 * may be missing when the linked page could not be read.
 */
public final class ExternalIdentity {

    private final String externalId;
    private final String externalLink;

    public ExternalIdentity(String externalId, String externalLink) {
        this.externalId = externalId;
        this.externalLink = Objects.requireNonNull(externalLink, "externalLink");
    }

    public String getExternalId() {
        return externalId;
    }

    public String getExternalLink() {
        return externalLink;
    }

    public boolean hasExternalId() {
        return externalId != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExternalIdentity)) {
            return false;
        }
        ExternalIdentity other = (ExternalIdentity) o;
        return Objects.equals(externalId, other.externalId) && externalLink.equals(other.externalLink);
    }

    @Override
    public int hashCode() {
        return Objects.hash(externalId, externalLink);
    }

    @Override
    public String toString() {
        return "ExternalIdentity{id=" + externalId + ", link=" + externalLink + "}";
    }
}
