package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.domain.model.MemoryKind;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes per-user memory analytics on demand.
 */
@Component
public class UserMemoryAnalyzer {

    private final MemoryStore memoryStore;
    private final Clock clock;

    public UserMemoryAnalyzer(MemoryStore memoryStore, Clock clock) {
        this.memoryStore = memoryStore;
        this.clock = clock;
    }

    public UserMemoryProfile analyze(String userId) {
        Instant now = clock.instant();
        List<MemoryItem> items = memoryStore.itemsOfUser(userId);

        Map<MemoryKind, Long> byKind = new EnumMap<>(MemoryKind.class);
        Map<UserMemoryProfile.AgeBucket, Long> ages = new EnumMap<>(UserMemoryProfile.AgeBucket.class);
        for (UserMemoryProfile.AgeBucket bucket : UserMemoryProfile.AgeBucket.values()) {
            ages.put(bucket, 0L);
        }
        Map<String, Long> byAgent = new TreeMap<>();
        double importance = 0.0;
        long active = 0;

        for (MemoryItem item : items) {
            byKind.merge(item.getKind(), 1L, Long::sum);
            byAgent.merge(item.getAgentType(), 1L, Long::sum);
            ages.merge(bucketOf(Duration.between(item.getCreatedAt(), now)), 1L, Long::sum);
            importance += item.getImportance();
            if (item.isActive()) {
                active++;
            }
        }

        return UserMemoryProfile.builder()
                .userId(userId)
                .totalItems(items.size())
                .activeItems(active)
                .byKind(byKind)
                .byAgent(byAgent)
                .ageDistribution(ages)
                .averageImportance(items.isEmpty() ? 0.0 : importance / items.size())
                .computedAt(now)
                .build();
    }

    static UserMemoryProfile.AgeBucket bucketOf(Duration age) {
        if (age.compareTo(Duration.ofDays(1)) < 0) {
            return UserMemoryProfile.AgeBucket.RECENT;
        }
        if (age.compareTo(Duration.ofDays(7)) < 0) {
            return UserMemoryProfile.AgeBucket.SHORT_TERM;
        }
        if (age.compareTo(Duration.ofDays(28)) < 0) {
            return UserMemoryProfile.AgeBucket.MEDIUM_TERM;
        }
        return UserMemoryProfile.AgeBucket.LONG_TERM;
    }
}
