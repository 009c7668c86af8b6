package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.common.exception.StoreConflictException;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.AssociationLabel;
import com.z254.prophantom.hive.domain.model.ConsolidationState;
import com.z254.prophantom.hive.domain.model.MemoryAssociation;
import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.domain.model.MemoryKind;
import com.z254.prophantom.hive.domain.model.ScoredMemory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory implementation of the universal memory store.
 * <p>
 * Items live in a concurrent map; a per (user, agent type) index holds the ids of
 * active items. Every mutation of the map or index happens under one short lock.
 * Reads never take the lock. Consolidation plans against a lock-free snapshot and
 * applies each change set under the lock after checking item versions.
 */
@Repository
@Slf4j
public class InMemoryMemoryStore implements MemoryStore {

    private final Map<String, MemoryItem> items = new ConcurrentHashMap<>();
    private final Map<Scope, Set<String>> activeIndex = new ConcurrentHashMap<>();
    private final Map<String, MemoryAssociation> associations = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> edgesByItem = new ConcurrentHashMap<>();

    private final ReentrantLock indexLock = new ReentrantLock();
    private final AtomicBoolean consolidating = new AtomicBoolean(false);
    private final AtomicReference<ConsolidationReport> lastReport = new AtomicReference<>();

    private final HiveProperties.MemoryProperties config;
    private final RelevanceScorer scorer;
    private final ConsolidationPlanner planner;
    private final Clock clock;

    // guarded by indexLock
    private long sequence;
    private Instant lastCreatedAt = Instant.EPOCH;

    private record Scope(String userId, String agentType) {
    }

    public InMemoryMemoryStore(HiveProperties properties, Clock clock) {
        this.config = properties.getMemory();
        this.scorer = new RelevanceScorer(config);
        this.planner = new ConsolidationPlanner(config);
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public String write(MemoryItem item) {
        validate(item);
        String id = item.getId() != null ? item.getId() : UUID.randomUUID().toString();

        indexLock.lock();
        try {
            if (items.containsKey(id)) {
                throw new IllegalArgumentException("Memory item already exists: " + id);
            }
            MemoryItem stored = item.toBuilder()
                    .id(id)
                    .importance(clamp(item.getImportance()))
                    .createdAt(nextCreatedAt())
                    .lastAccessAt(null)
                    .accessCount(0)
                    .lastDecayedAt(null)
                    .state(ConsolidationState.RAW)
                    .consolidatedInto(null)
                    .sequence(++sequence)
                    .version(1)
                    .build();
            insert(stored);
        } finally {
            indexLock.unlock();
        }
        log.debug("Stored {} memory {} for user {} / {}", item.getKind(), id, item.getUserId(), item.getAgentType());
        return id;
    }

    @Override
    public MemoryAssociation associate(String fromId, String toId, double weight, AssociationLabel label) {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        Objects.requireNonNull(label, "label");
        if (fromId.equals(toId)) {
            throw new IllegalArgumentException("An item cannot be associated with itself: " + fromId);
        }
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("Association weight must be within [0,1]: " + weight);
        }

        indexLock.lock();
        try {
            MemoryItem from = items.get(fromId);
            MemoryItem to = items.get(toId);
            if (from == null || to == null) {
                throw new IllegalArgumentException("Unknown memory item: " + (from == null ? fromId : toId));
            }
            MemoryAssociation edge = MemoryAssociation.builder()
                    .id(UUID.randomUUID().toString())
                    .fromId(fromId)
                    .toId(toId)
                    .weight(weight)
                    .label(label)
                    .createdAt(clock.instant())
                    .stale(!from.isActive() || !to.isActive())
                    .build();
            addEdge(edge);
            return edge;
        } finally {
            indexLock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Override
    public List<MemoryItem> query(String userId, String agentType, String text, int k) {
        return rank(userId, agentType, text, k).stream()
                .map(ScoredMemory::getItem)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScoredMemory> rank(String userId, String agentType, String text, int k) {
        if (k <= 0) {
            return List.of();
        }
        List<MemoryItem> candidates = activeIndex.getOrDefault(new Scope(userId, agentType), Set.of()).stream()
                .map(items::get)
                .filter(Objects::nonNull)
                .filter(MemoryItem::isActive)
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return List.of();
        }

        Instant reference = candidates.stream()
                .map(MemoryItem::getCreatedAt)
                .max(Comparator.naturalOrder())
                .orElseThrow();
        String query = text != null ? text : "";
        Set<String> queryTokens = RelevanceScorer.tokenize(query);

        List<ScoredMemory> ranked = candidates.stream()
                .map(item -> scorer.score(item, query, queryTokens, reference))
                .sorted(RelevanceScorer.RANKING)
                .limit(k)
                .collect(Collectors.toList());
        return touch(ranked);
    }

    private List<ScoredMemory> touch(List<ScoredMemory> ranked) {
        Instant now = clock.instant();
        List<ScoredMemory> touched = new ArrayList<>(ranked.size());
        indexLock.lock();
        try {
            for (ScoredMemory scored : ranked) {
                MemoryItem current = items.get(scored.getItem().getId());
                if (current == null || !current.isActive()) {
                    touched.add(scored);
                    continue;
                }
                MemoryItem updated = current.toBuilder()
                        .lastAccessAt(now)
                        .accessCount(current.getAccessCount() + 1)
                        .version(current.getVersion() + 1)
                        .build();
                items.put(updated.getId(), updated);
                touched.add(new ScoredMemory(updated, scored.getRelevance()));
            }
        } finally {
            indexLock.unlock();
        }
        return touched;
    }

    @Override
    public Optional<MemoryItem> get(String id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public List<MemoryAssociation> associationsOf(String itemId) {
        return edgesByItem.getOrDefault(itemId, Set.of()).stream()
                .map(associations::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(MemoryAssociation::getCreatedAt)
                        .thenComparing(MemoryAssociation::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<MemoryItem> itemsOfUser(String userId) {
        return items.values().stream()
                .filter(item -> item.getUserId().equals(userId))
                .sorted(Comparator.comparingLong(MemoryItem::getSequence))
                .collect(Collectors.toList());
    }

    @Override
    public MemoryStats stats() {
        Map<MemoryKind, Long> byKind = new EnumMap<>(MemoryKind.class);
        Map<ConsolidationState, Long> byState = new EnumMap<>(ConsolidationState.class);
        double importanceSum = 0.0;
        long total = 0;
        for (MemoryItem item : items.values()) {
            byKind.merge(item.getKind(), 1L, Long::sum);
            byState.merge(item.getState(), 1L, Long::sum);
            importanceSum += item.getImportance();
            total++;
        }
        long archived = byState.getOrDefault(ConsolidationState.ARCHIVED, 0L);
        long stale = associations.values().stream().filter(MemoryAssociation::isStale).count();
        return MemoryStats.builder()
                .totalItems(total)
                .activeItems(total - archived)
                .archivedItems(archived)
                .byKind(byKind)
                .byState(byState)
                .associations(associations.size())
                .staleAssociations(stale)
                .averageImportance(total > 0 ? importanceSum / total : 0.0)
                .build();
    }

    @Override
    public Optional<ConsolidationReport> lastConsolidation() {
        return Optional.ofNullable(lastReport.get());
    }

    // ------------------------------------------------------------------
    // Consolidation
    // ------------------------------------------------------------------

    @Override
    public ConsolidationReport consolidate() {
        Instant startedAt = clock.instant();
        if (!consolidating.compareAndSet(false, true)) {
            log.debug("Consolidation already in progress, skipping");
            return ConsolidationReport.skipped(startedAt);
        }
        try {
            ConsolidationReport report = runConsolidation(startedAt);
            lastReport.set(report);
            return report;
        } finally {
            consolidating.set(false);
        }
    }

    private ConsolidationReport runConsolidation(Instant startedAt) {
        long cutoff;
        long totalBefore;
        indexLock.lock();
        try {
            cutoff = sequence;
            totalBefore = items.size();
        } finally {
            indexLock.unlock();
        }

        List<MemoryItem> snapshot = snapshotUpTo(cutoff);
        List<ChangeSet> plan = plan(snapshot, startedAt);

        int groups = 0;
        int consolidated = 0;
        int decayed = 0;
        int archived = 0;
        int conflicts = 0;
        for (ChangeSet changeSet : plan) {
            try {
                apply(changeSet);
                if (changeSet.getSummary() != null) {
                    groups++;
                    consolidated += changeSet.getSummarizedIds().size();
                }
                decayed += changeSet.getDecayed();
                archived += changeSet.getArchived();
            } catch (StoreConflictException e) {
                conflicts++;
                log.debug("Change set rescheduled to next pass: {}", e.getMessage());
            }
        }

        long totalAfter;
        indexLock.lock();
        try {
            totalAfter = items.size();
        } finally {
            indexLock.unlock();
        }

        ConsolidationReport report = ConsolidationReport.builder()
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .examined(snapshot.size())
                .groupsConsolidated(groups)
                .summariesCreated(groups)
                .itemsConsolidated(consolidated)
                .itemsDecayed(decayed)
                .itemsArchived(archived)
                .conflicts(conflicts)
                .totalItemsBefore(totalBefore)
                .totalItemsAfter(totalAfter)
                .build();
        log.info("Consolidation pass: examined={}, summaries={}, decayed={}, archived={}, conflicts={}",
                report.getExamined(), groups, decayed, archived, conflicts);
        return report;
    }

    /**
     * Items written after the cutoff belong to the next pass.
     */
    List<MemoryItem> snapshotUpTo(long cutoff) {
        return items.values().stream()
                .filter(item -> item.getSequence() <= cutoff)
                .collect(Collectors.toList());
    }

    List<ChangeSet> plan(List<MemoryItem> snapshot, Instant now) {
        return planner.plan(snapshot, now);
    }

    private void apply(ChangeSet changeSet) {
        indexLock.lock();
        try {
            for (MemoryItem snapshot : changeSet.getExpected().values()) {
                MemoryItem current = items.get(snapshot.getId());
                if (current != null && current.getVersion() == snapshot.getVersion()) {
                    continue;
                }
                // A read in between only moved the access statistics
                if (current != null && changeSet.toleratesAccess(snapshot.getId()) && current.sameContentAs(snapshot)) {
                    continue;
                }
                throw new StoreConflictException(snapshot.getId(), snapshot.getVersion(),
                        current != null ? current.getVersion() : -1L);
            }

            for (MemoryItem replacement : changeSet.replacementItems()) {
                MemoryItem current = items.get(replacement.getId());
                MemoryItem next = replacement.toBuilder()
                        .lastAccessAt(current.getLastAccessAt())
                        .accessCount(current.getAccessCount())
                        .version(current.getVersion() + 1)
                        .build();
                items.put(next.getId(), next);
                if (!next.isActive()) {
                    removeFromIndex(next);
                    markEdgesStale(next.getId());
                }
            }

            MemoryItem summary = changeSet.getSummary();
            if (summary != null) {
                MemoryItem stored = summary.toBuilder()
                        .createdAt(nextCreatedAt())
                        .sequence(++sequence)
                        .version(1)
                        .build();
                insert(stored);
                for (String sourceId : changeSet.getSummarizedIds()) {
                    MemoryItem source = items.get(sourceId);
                    addEdge(MemoryAssociation.builder()
                            .id(UUID.randomUUID().toString())
                            .fromId(stored.getId())
                            .toId(sourceId)
                            .weight(1.0)
                            .label(AssociationLabel.SUMMARIZES)
                            .createdAt(stored.getCreatedAt())
                            .stale(source == null || !source.isActive())
                            .build());
                }
            }
        } finally {
            indexLock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Index maintenance (callers hold indexLock)
    // ------------------------------------------------------------------

    private void insert(MemoryItem item) {
        items.put(item.getId(), item);
        activeIndex.computeIfAbsent(new Scope(item.getUserId(), item.getAgentType()),
                scope -> ConcurrentHashMap.newKeySet()).add(item.getId());
    }

    private void removeFromIndex(MemoryItem item) {
        Set<String> ids = activeIndex.get(new Scope(item.getUserId(), item.getAgentType()));
        if (ids != null) {
            ids.remove(item.getId());
        }
    }

    private void addEdge(MemoryAssociation edge) {
        associations.put(edge.getId(), edge);
        edgesByItem.computeIfAbsent(edge.getFromId(), id -> ConcurrentHashMap.newKeySet()).add(edge.getId());
        edgesByItem.computeIfAbsent(edge.getToId(), id -> ConcurrentHashMap.newKeySet()).add(edge.getId());
    }

    private void markEdgesStale(String itemId) {
        for (String edgeId : edgesByItem.getOrDefault(itemId, Set.of())) {
            associations.computeIfPresent(edgeId, (id, edge) ->
                    edge.isStale() ? edge : edge.toBuilder().stale(true).build());
        }
    }

    /**
     * Creation times are strictly increasing across the store.
     */
    private Instant nextCreatedAt() {
        Instant now = clock.instant();
        if (!now.isAfter(lastCreatedAt)) {
            now = lastCreatedAt.plusNanos(1_000);
        }
        lastCreatedAt = now;
        return now;
    }

    private static void validate(MemoryItem item) {
        Objects.requireNonNull(item, "item");
        if (item.getUserId() == null || item.getAgentType() == null) {
            throw new IllegalArgumentException("Memory item requires userId and agentType");
        }
        if (item.getKind() == null) {
            throw new IllegalArgumentException("Memory item requires a kind");
        }
        if (item.getContent() == null || item.getContent().isBlank()) {
            throw new IllegalArgumentException("Memory item requires content");
        }
    }

    private static double clamp(double importance) {
        if (Double.isNaN(importance)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, importance));
    }
}
