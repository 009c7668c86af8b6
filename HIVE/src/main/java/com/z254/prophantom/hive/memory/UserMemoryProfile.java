package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.domain.model.MemoryKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Memory analytics for one user across all agents.
 */
@Value
@Builder
public class UserMemoryProfile {

    public enum AgeBucket {
        /** Younger than a day. */
        RECENT,
        /** Younger than a week. */
        SHORT_TERM,
        /** Younger than four weeks. */
        MEDIUM_TERM,
        LONG_TERM
    }

    String userId;
    long totalItems;
    long activeItems;
    Map<MemoryKind, Long> byKind;
    Map<String, Long> byAgent;
    Map<AgeBucket, Long> ageDistribution;
    double averageImportance;
    Instant computedAt;
}
