package com.z254.prophantom.hive.domain.repository.impl;

import com.z254.prophantom.hive.domain.model.ContextSnapshot;
import com.z254.prophantom.hive.domain.repository.ContextSnapshotRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of ContextSnapshotRepository.
 */
@Repository
public class InMemoryContextSnapshotRepository implements ContextSnapshotRepository {

    private final Map<String, ContextSnapshot> active = new ConcurrentHashMap<>();
    private final Map<String, ContextSnapshot> archived = new ConcurrentHashMap<>();

    @Override
    public ContextSnapshot save(ContextSnapshot snapshot) {
        if (active.putIfAbsent(snapshot.getId(), snapshot) != null) {
            throw new IllegalArgumentException("Context snapshots are immutable: " + snapshot.getId());
        }
        return snapshot;
    }

    @Override
    public Optional<ContextSnapshot> findById(String id) {
        ContextSnapshot snapshot = active.get(id);
        return Optional.ofNullable(snapshot != null ? snapshot : archived.get(id));
    }

    @Override
    public List<ContextSnapshot> findBySession(String sessionId) {
        return Stream.concat(active.values().stream(), archived.values().stream())
                .filter(snapshot -> sessionId.equals(snapshot.getSessionId()))
                .sorted(Comparator.comparing(ContextSnapshot::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public int archiveCreatedBefore(Instant cutoff) {
        int moved = 0;
        for (ContextSnapshot snapshot : active.values()) {
            if (snapshot.getCreatedAt().isBefore(cutoff) && active.remove(snapshot.getId(), snapshot)) {
                archived.put(snapshot.getId(), snapshot);
                moved++;
            }
        }
        return moved;
    }

    @Override
    public long countActive() {
        return active.size();
    }

    @Override
    public long countArchived() {
        return archived.size();
    }
}
