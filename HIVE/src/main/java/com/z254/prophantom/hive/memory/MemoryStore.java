package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.domain.model.AssociationLabel;
import com.z254.prophantom.hive.domain.model.MemoryAssociation;
import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.domain.model.ScoredMemory;

import java.util.List;
import java.util.Optional;

/**
 * Typed, associative memory shared by all agents.
 * <p>
 * Implementations must allow {@link #consolidate()} to run concurrently with
 * writes and queries. Items are never deleted: consolidation only reclassifies them.
 */
public interface MemoryStore {

    /**
     * Append a new item. The store assigns id (when absent), creation time,
     * sequence and version; the item starts RAW.
     *
     * @return the item id
     */
    String write(MemoryItem item);

    /**
     * Add a directed edge between two existing items.
     *
     * @throws IllegalArgumentException on self-loops, unknown ids or a weight outside [0,1]
     */
    MemoryAssociation associate(String fromId, String toId, double weight, AssociationLabel label);

    /**
     * Top-k active items for (userId, agentType) ordered by {@link RelevanceScorer#RANKING}.
     * Returned items have their access statistics updated.
     */
    List<MemoryItem> query(String userId, String agentType, String text, int k);

    /**
     * Same as {@link #query} but keeps the relevance of each item.
     */
    List<ScoredMemory> rank(String userId, String agentType, String text, int k);

    /**
     * Run one consolidation pass. Returns a skipped report if a pass is already running.
     */
    ConsolidationReport consolidate();

    Optional<MemoryItem> get(String id);

    List<MemoryAssociation> associationsOf(String itemId);

    /**
     * All items owned by the user, archived included.
     */
    List<MemoryItem> itemsOfUser(String userId);

    MemoryStats stats();

    Optional<ConsolidationReport> lastConsolidation();
}
