package com.z254.prophantom.hive.agent;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.SessionTier;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Derives the relationship tier of a session from its interaction count.
 * Thresholds and milestones come from configuration.
 */
@Component
public class TierPolicy {

    private final List<HiveProperties.TierDefinition> levels;
    private final List<Long> milestones;

    public TierPolicy(HiveProperties properties) {
        List<HiveProperties.TierDefinition> configured = properties.getTiers().getLevels();
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("At least one tier must be configured under hive.tiers.levels");
        }
        this.levels = configured.stream()
                .sorted(Comparator.comparingLong(HiveProperties.TierDefinition::getThreshold))
                .collect(Collectors.toList());
        this.milestones = properties.getTiers().getMilestones().stream()
                .sorted()
                .collect(Collectors.toList());
    }

    public SessionTier initialTier() {
        return toTier(levels.get(0));
    }

    /**
     * Tier for an interaction count, ignoring history.
     */
    public SessionTier tierFor(long interactionCount) {
        HiveProperties.TierDefinition match = levels.get(0);
        for (HiveProperties.TierDefinition level : levels) {
            if (interactionCount >= level.getThreshold()) {
                match = level;
            }
        }
        return toTier(match);
    }

    /**
     * Tier after an interaction. Never lower than the current tier.
     */
    public SessionTier advance(long interactionCount, SessionTier current) {
        SessionTier derived = tierFor(interactionCount);
        if (current == null) {
            return derived;
        }
        return derived.compareTo(current) >= 0 ? derived : current;
    }

    public OptionalLong nextMilestone(long interactionCount) {
        return milestones.stream()
                .mapToLong(Long::longValue)
                .filter(milestone -> milestone > interactionCount)
                .findFirst();
    }

    public Optional<SessionTier> nextTier(long interactionCount) {
        return levels.stream()
                .filter(level -> level.getThreshold() > interactionCount)
                .findFirst()
                .map(TierPolicy::toTier);
    }

    public OptionalLong nextTierThreshold(long interactionCount) {
        return levels.stream()
                .mapToLong(HiveProperties.TierDefinition::getThreshold)
                .filter(threshold -> threshold > interactionCount)
                .findFirst();
    }

    private static SessionTier toTier(HiveProperties.TierDefinition definition) {
        return new SessionTier(definition.getLevel(), definition.getName());
    }
}
