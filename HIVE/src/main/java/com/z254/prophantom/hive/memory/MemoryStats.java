package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.domain.model.ConsolidationState;
import com.z254.prophantom.hive.domain.model.MemoryKind;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time counts over the whole store.
 */
@Value
@Builder
public class MemoryStats {
    long totalItems;
    long activeItems;
    long archivedItems;
    Map<MemoryKind, Long> byKind;
    Map<ConsolidationState, Long> byState;
    long associations;
    long staleAssociations;
    double averageImportance;

    public static MemoryStats empty() {
        return MemoryStats.builder()
                .byKind(Map.of())
                .byState(Map.of())
                .build();
    }
}
