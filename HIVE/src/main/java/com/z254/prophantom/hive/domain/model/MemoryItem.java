package com.z254.prophantom.hive.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One recorded fact or experience.
 * <p>
 * Items are immutable values. The memory store replaces an item with a new
 * version (same id, same kind) when its state, importance or access statistics change.
 */
@Value
@Builder(toBuilder = true)
public class MemoryItem {

    String id;

    String userId;

    String agentType;

    MemoryKind kind;

    /**
     * Free text payload.
     */
    String content;

    /**
     * Structured tags attached to the payload.
     */
    @Singular
    Set<String> tags;

    @Singular
    Map<String, String> attributes;

    /**
     * Importance in [0,1]. Decays during consolidation.
     */
    double importance;

    Instant createdAt;

    Instant lastAccessAt;

    long accessCount;

    /**
     * Last consolidation pass that decayed the item.
     */
    Instant lastDecayedAt;

    @Builder.Default
    ConsolidationState state = ConsolidationState.RAW;

    /**
     * Id of the summary this item was folded into, if any.
     */
    String consolidatedInto;

    /**
     * Store-assigned write order.
     */
    long sequence;

    /**
     * Bumped on every replacement.
     */
    long version;

    public boolean isActive() {
        return state != ConsolidationState.ARCHIVED;
    }

    /**
     * Last time the item was read, or its creation time when it never was.
     */
    public Instant lastTouchedAt() {
        return lastAccessAt != null ? lastAccessAt : createdAt;
    }

    /**
     * Start of the current idle period: the later of the last read and the last decay.
     */
    public Instant idleSince() {
        Instant touched = lastTouchedAt();
        if (lastDecayedAt == null || touched == null) {
            return touched;
        }
        return lastDecayedAt.isAfter(touched) ? lastDecayedAt : touched;
    }

    /**
     * True when the two values differ only in access statistics and version.
     */
    public boolean sameContentAs(MemoryItem other) {
        return other != null && equals(other.toBuilder()
                .lastAccessAt(lastAccessAt)
                .accessCount(accessCount)
                .version(version)
                .build());
    }
}
