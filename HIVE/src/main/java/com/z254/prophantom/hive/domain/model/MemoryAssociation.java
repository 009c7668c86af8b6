package com.z254.prophantom.hive.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Directed weighted edge between two memory items.
 */
@Value
@Builder(toBuilder = true)
public class MemoryAssociation {

    String id;

    String fromId;

    String toId;

    double weight;

    AssociationLabel label;

    Instant createdAt;

    /**
     * Set when either endpoint has been archived.
     */
    boolean stale;

    public boolean touches(String itemId) {
        return fromId.equals(itemId) || toId.equals(itemId);
    }
}
