package com.z254.prophantom.hive.memory;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one consolidation pass.
 */
@Value
@Builder
public class ConsolidationReport {

    Instant startedAt;

    Instant completedAt;

    /**
     * True when the pass did not run because another pass was in progress.
     */
    boolean skipped;

    /**
     * Items in the pass snapshot.
     */
    int examined;

    int groupsConsolidated;

    int summariesCreated;

    int itemsConsolidated;

    int itemsDecayed;

    int itemsArchived;

    /**
     * Change sets abandoned because an item changed under the pass. They are retried next pass.
     */
    int conflicts;

    long totalItemsBefore;

    long totalItemsAfter;

    public long durationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    static ConsolidationReport skipped(Instant now) {
        return ConsolidationReport.builder()
                .startedAt(now)
                .completedAt(now)
                .skipped(true)
                .build();
    }
}
