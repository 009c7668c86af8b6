package com.z254.prophantom.hive.domain.model;

import lombok.Value;

/**
 * A memory item together with the relevance it scored for one query.
 */
@Value
public class ScoredMemory {
    MemoryItem item;
    double relevance;
}
