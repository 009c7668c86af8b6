package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.ConsolidationState;
import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.domain.model.MemoryKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Plans one consolidation pass over a snapshot of the store.
 * <ol>
 *     <li>group RAW items by user, agent type and closed time window</li>
 *     <li>summarize groups whose combined importance exceeds the threshold</li>
 *     <li>decay items idle for a full access window since their last read or last decay</li>
 *     <li>archive items whose importance falls below the floor, or that exceed the per-user cap</li>
 * </ol>
 * The planner never touches the store; it only produces change sets.
 */
class ConsolidationPlanner {

    static final String SUMMARY_TAG = "summary";
    static final String ATTR_WINDOW_START = "windowStart";
    static final String ATTR_WINDOW_END = "windowEnd";
    static final String ATTR_SOURCE_COUNT = "sourceCount";

    private static final int MAX_THEMES = 5;
    private static final int MIN_THEME_LENGTH = 5;
    private static final int HIGHLIGHTS = 3;
    private static final int HIGHLIGHT_LENGTH = 80;

    private final HiveProperties.ConsolidationProperties config;
    private final int maxItemsPerUser;

    ConsolidationPlanner(HiveProperties.MemoryProperties memoryConfig) {
        this.config = memoryConfig.getConsolidation();
        this.maxItemsPerUser = memoryConfig.getMaxItemsPerUser();
    }

    private record GroupKey(String userId, String agentType, long bucket) {
    }

    List<ChangeSet> plan(List<MemoryItem> snapshot, Instant now) {
        List<MemoryItem> ordered = snapshot.stream()
                .filter(MemoryItem::isActive)
                .sorted(Comparator.comparingLong(MemoryItem::getSequence))
                .collect(Collectors.toList());

        List<ChangeSet> changeSets = new ArrayList<>();
        Map<String, ChangeSet> owners = new HashMap<>();

        planSummaries(ordered, now, changeSets, owners);
        planDecay(ordered, now, changeSets, owners);
        planCap(ordered, changeSets, owners);

        changeSets.removeIf(ChangeSet::isEmpty);
        return changeSets;
    }

    private void planSummaries(List<MemoryItem> ordered, Instant now,
                               List<ChangeSet> changeSets, Map<String, ChangeSet> owners) {
        long windowMillis = Math.max(1, config.getWindow().toMillis());
        Map<GroupKey, List<MemoryItem>> groups = ordered.stream()
                .filter(item -> item.getState() == ConsolidationState.RAW)
                .collect(Collectors.groupingBy(
                        item -> new GroupKey(item.getUserId(), item.getAgentType(),
                                Math.floorDiv(item.getCreatedAt().toEpochMilli(), windowMillis)),
                        LinkedHashMap::new,
                        Collectors.toList()));

        groups.forEach((key, group) -> {
            Instant windowStart = Instant.ofEpochMilli(key.bucket() * windowMillis);
            Instant windowEnd = windowStart.plusMillis(windowMillis);
            if (windowEnd.isAfter(now) || group.size() < config.getMinGroupSize()) {
                return;
            }
            double combined = group.stream().mapToDouble(MemoryItem::getImportance).sum();
            if (combined <= config.getThreshold()) {
                return;
            }

            String summaryId = UUID.randomUUID().toString();
            ChangeSet changeSet = new ChangeSet(synthesize(summaryId, key, group, windowStart, windowEnd));
            for (MemoryItem original : group) {
                changeSet.summarize(original, original.toBuilder()
                        .state(ConsolidationState.CONSOLIDATED)
                        .consolidatedInto(summaryId)
                        .build());
                owners.put(original.getId(), changeSet);
            }
            changeSets.add(changeSet);
        });
    }

    private void planDecay(List<MemoryItem> ordered, Instant now,
                           List<ChangeSet> changeSets, Map<String, ChangeSet> owners) {
        Instant accessCutoff = now.minus(config.getAccessWindow());
        for (MemoryItem original : ordered) {
            // One decay step per idle access window, however often passes run
            if (!original.idleSince().isBefore(accessCutoff)) {
                continue;
            }
            ChangeSet changeSet = ownerOf(original, changeSets, owners);
            MemoryItem current = changeSet.current(original);
            double decayed = current.getImportance() * config.getDecayFactor();
            boolean archive = decayed < config.getArchiveFloor();
            changeSet.decay(current.toBuilder()
                    .importance(decayed)
                    .lastDecayedAt(now)
                    .state(archive ? ConsolidationState.ARCHIVED : current.getState())
                    .build(), archive);
        }
    }

    private void planCap(List<MemoryItem> ordered, List<ChangeSet> changeSets, Map<String, ChangeSet> owners) {
        Map<String, List<MemoryItem>> byUser = new HashMap<>();
        for (MemoryItem original : ordered) {
            ChangeSet owner = owners.get(original.getId());
            MemoryItem current = owner != null ? owner.current(original) : original;
            if (current.isActive()) {
                byUser.computeIfAbsent(original.getUserId(), u -> new ArrayList<>()).add(original);
            }
        }
        byUser.values().forEach(active -> {
            int excess = active.size() - maxItemsPerUser;
            if (excess <= 0) {
                return;
            }
            active.stream()
                    .sorted(Comparator.comparingDouble((MemoryItem item) -> currentOf(item, owners).getImportance())
                            .thenComparing(MemoryItem::getCreatedAt))
                    .limit(excess)
                    .forEach(original -> {
                        ChangeSet changeSet = ownerOf(original, changeSets, owners);
                        changeSet.archive(changeSet.current(original).toBuilder()
                                .state(ConsolidationState.ARCHIVED)
                                .build());
                    });
        });
    }

    private MemoryItem currentOf(MemoryItem original, Map<String, ChangeSet> owners) {
        ChangeSet owner = owners.get(original.getId());
        return owner != null ? owner.current(original) : original;
    }

    private ChangeSet ownerOf(MemoryItem original, List<ChangeSet> changeSets, Map<String, ChangeSet> owners) {
        return owners.computeIfAbsent(original.getId(), id -> {
            ChangeSet changeSet = new ChangeSet(null);
            changeSet.expect(original);
            changeSets.add(changeSet);
            return changeSet;
        });
    }

    private MemoryItem synthesize(String summaryId, GroupKey key, List<MemoryItem> group,
                                  Instant windowStart, Instant windowEnd) {
        List<String> themes = themes(group);
        String highlights = group.stream()
                .limit(HIGHLIGHTS)
                .map(item -> abbreviate(item.getContent()))
                .collect(Collectors.joining(" | "));

        StringBuilder content = new StringBuilder()
                .append("Consolidated ").append(group.size()).append(" memories");
        if (!themes.isEmpty()) {
            content.append(". Themes: ").append(String.join(", ", themes));
        }
        content.append(". Highlights: ").append(highlights);

        MemoryItem.MemoryItemBuilder builder = MemoryItem.builder()
                .id(summaryId)
                .userId(key.userId())
                .agentType(key.agentType())
                .kind(MemoryKind.SEMANTIC)
                .content(content.toString())
                .importance(group.stream().mapToDouble(MemoryItem::getImportance).max().orElse(0.0))
                .state(ConsolidationState.CONSOLIDATED)
                .tag(SUMMARY_TAG)
                .attribute(ATTR_WINDOW_START, windowStart.toString())
                .attribute(ATTR_WINDOW_END, windowEnd.toString())
                .attribute(ATTR_SOURCE_COUNT, String.valueOf(group.size()));
        themes.forEach(builder::tag);
        return builder.build();
    }

    /**
     * Words longer than four characters that occur at least twice across the group.
     */
    static List<String> themes(List<MemoryItem> group) {
        Map<String, Integer> counts = new HashMap<>();
        for (MemoryItem item : group) {
            if (item.getContent() == null) {
                continue;
            }
            for (String word : item.getContent().toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
                if (word.length() >= MIN_THEME_LENGTH) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
        }
        return counts.entrySet().stream()
                .filter(e -> e.getValue() >= 2)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_THEMES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= HIGHLIGHT_LENGTH ? flat : flat.substring(0, HIGHLIGHT_LENGTH - 3) + "...";
    }
}
