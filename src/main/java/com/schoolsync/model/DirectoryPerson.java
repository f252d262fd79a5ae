package com.schoolsync.model;

import java.time.Instant;

/**
 * Columns shared by every person mirrored from the directory. {@code id} is
 * the local key used only for relations; {@code personId} correlates the row
 * with the remote record.
 */
public abstract class DirectoryPerson {

    private Long id;
    private long personId;
    private String externalId;
    private String externalLink;
    private String lastName;
    private String firstName;
    private String middleName;
    private String email;
    private String phone;
    private boolean active = true;
    private Instant deactivatedAt;
    private Instant lastSeenAt;
    private Instant createdAt;
    private Instant updatedAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public long getPersonId() { return personId; }
    public void setPersonId(long personId) { this.personId = personId; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public String getExternalLink() { return externalLink; }
    public void setExternalLink(String externalLink) { this.externalLink = externalLink; }
    public String getLastName() { return lastName; }
    public void setLastName(String lastName) { this.lastName = lastName; }
    public String getFirstName() { return firstName; }
    public void setFirstName(String firstName) { this.firstName = firstName; }
    public String getMiddleName() { return middleName; }
    public void setMiddleName(String middleName) { this.middleName = middleName; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String getPhone() { return phone; }
    public void setPhone(String phone) { this.phone = phone; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getDeactivatedAt() { return deactivatedAt; }
    public void setDeactivatedAt(Instant deactivatedAt) { this.deactivatedAt = deactivatedAt; }
    public Instant getLastSeenAt() { return lastSeenAt; }
    public void setLastSeenAt(Instant lastSeenAt) { this.lastSeenAt = lastSeenAt; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /**
     * Marks the row as seen in the current fetch.
     */
    public void markSeen(Instant now) {
        active = true;
        deactivatedAt = null;
        lastSeenAt = now;
        updatedAt = now;
    }

    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{lastName, firstName, middleName}) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part);
            }
        }
        return sb.length() > 0 ? sb.toString() : String.valueOf(personId);
    }
}
