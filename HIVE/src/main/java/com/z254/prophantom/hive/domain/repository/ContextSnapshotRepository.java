package com.z254.prophantom.hive.domain.repository;

import com.z254.prophantom.hive.domain.model.ContextSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Audit store for context snapshots.
 */
public interface ContextSnapshotRepository {

    ContextSnapshot save(ContextSnapshot snapshot);

    Optional<ContextSnapshot> findById(String id);

    List<ContextSnapshot> findBySession(String sessionId);

    /**
     * Move snapshots created before the cutoff to the archive.
     *
     * @return number of snapshots archived
     */
    int archiveCreatedBefore(Instant cutoff);

    long countActive();

    long countArchived();
}
