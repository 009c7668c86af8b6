package com.z254.prophantom.hive.domain.model;

/**
 * Kind of a memory item. Fixed at creation.
 * The weight scales retrieval relevance for items of that kind.
 */
public enum MemoryKind {
    EPISODIC(1.0),
    SEMANTIC(0.9),
    PROCEDURAL(0.8),
    EMOTIONAL(1.1);

    private final double weight;

    MemoryKind(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
