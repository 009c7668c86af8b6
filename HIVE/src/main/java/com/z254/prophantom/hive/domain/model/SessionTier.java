package com.z254.prophantom.hive.domain.model;

import lombok.Value;

/**
 * Relationship tier of a session, derived from its interaction count.
 */
@Value
public class SessionTier implements Comparable<SessionTier> {

    int level;

    String name;

    @Override
    public int compareTo(SessionTier other) {
        return Integer.compare(level, other.level);
    }
}
