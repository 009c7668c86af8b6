package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.domain.model.MemoryItem;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unit of work produced by a consolidation pass. Applied atomically, or not at all
 * when any expected item version no longer matches the store. Items that are only
 * summarized or capped tolerate reads in between; decayed items do not, since a
 * read restarts their idle period.
 */
@Getter
class ChangeSet {

    /**
     * Summary to insert, null for pure decay/archive change sets.
     */
    private final MemoryItem summary;

    /**
     * Snapshot value of every item the change set replaces, keyed by id.
     */
    private final Map<String, MemoryItem> expected = new LinkedHashMap<>();
    private final Map<String, MemoryItem> replacements = new LinkedHashMap<>();
    private final List<String> summarizedIds = new ArrayList<>();
    private final Set<String> accessSensitive = new HashSet<>();

    private int decayed;
    private int archived;

    ChangeSet(MemoryItem summary) {
        this.summary = summary;
    }

    void expect(MemoryItem snapshotVersion) {
        expected.putIfAbsent(snapshotVersion.getId(), snapshotVersion);
    }

    void summarize(MemoryItem original, MemoryItem replacement) {
        expect(original);
        replacements.put(original.getId(), replacement);
        summarizedIds.add(original.getId());
    }

    MemoryItem current(MemoryItem original) {
        return replacements.getOrDefault(original.getId(), original);
    }

    void decay(MemoryItem replacement, boolean archive) {
        replacements.put(replacement.getId(), replacement);
        accessSensitive.add(replacement.getId());
        decayed++;
        if (archive) {
            archived++;
        }
    }

    void archive(MemoryItem replacement) {
        replacements.put(replacement.getId(), replacement);
        archived++;
    }

    boolean toleratesAccess(String id) {
        return !accessSensitive.contains(id);
    }

    Collection<MemoryItem> replacementItems() {
        return replacements.values();
    }

    boolean isEmpty() {
        return summary == null && replacements.isEmpty();
    }
}
