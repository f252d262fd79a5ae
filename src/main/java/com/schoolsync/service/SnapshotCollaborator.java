package com.schoolsync.service;

import java.util.Optional;

/**
 * Backup hook invoked once before a run. Returns a handle describing the
 * snapshot, or empty when no snapshot was taken.
 */
public interface SnapshotCollaborator {

    Optional<String> createSnapshot();
}
