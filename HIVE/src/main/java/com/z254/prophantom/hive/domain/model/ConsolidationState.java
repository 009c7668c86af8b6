package com.z254.prophantom.hive.domain.model;

/**
 * Lifecycle of a memory item with respect to consolidation.
 */
public enum ConsolidationState {
    /** Freshly written, not yet seen by a consolidation pass. */
    RAW,
    /** Folded into a summary, or is itself a summary. Still queryable. */
    CONSOLIDATED,
    /** Removed from the active query index but retained for audit. */
    ARCHIVED
}
