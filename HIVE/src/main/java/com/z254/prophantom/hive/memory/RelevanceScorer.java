package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.domain.model.ScoredMemory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Scores memory items against a query text.
 * <p>
 * relevance = kindWeight * (recencyWeight * recency + similarityWeight * similarity)
 * <ul>
 *     <li>recency halves every half-life of age, where age is measured from the item's
 *     creation time to the newest candidate's creation time</li>
 *     <li>similarity is the share of query tokens found in the item's content and tags,
 *     plus a bonus when the whole query phrase occurs verbatim, capped at 1</li>
 * </ul>
 */
public class RelevanceScorer {

    /**
     * Ranking order: relevance desc, importance desc, creation time desc, id asc.
     */
    public static final Comparator<ScoredMemory> RANKING = Comparator
            .comparingDouble(ScoredMemory::getRelevance).reversed()
            .thenComparing(Comparator.comparingDouble((ScoredMemory s) -> s.getItem().getImportance()).reversed())
            .thenComparing((ScoredMemory s) -> s.getItem().getCreatedAt(), Comparator.reverseOrder())
            .thenComparing(s -> s.getItem().getId());

    private static final double PHRASE_BONUS = 0.5;

    private final double recencyWeight;
    private final double similarityWeight;
    private final double halfLifeSeconds;

    public RelevanceScorer(HiveProperties.MemoryProperties config) {
        this(config.getRecencyWeight(), config.getSimilarityWeight(), config.getRecencyHalfLife());
    }

    public RelevanceScorer(double recencyWeight, double similarityWeight, Duration halfLife) {
        this.recencyWeight = recencyWeight;
        this.similarityWeight = similarityWeight;
        this.halfLifeSeconds = Math.max(1.0, halfLife.toSeconds());
    }

    public ScoredMemory score(MemoryItem item, String query, Set<String> queryTokens, Instant reference) {
        double relevance = item.getKind().weight()
                * (recencyWeight * recency(item.getCreatedAt(), reference)
                + similarityWeight * similarity(item, query, queryTokens));
        return new ScoredMemory(item, relevance);
    }

    double recency(Instant createdAt, Instant reference) {
        double ageSeconds = Math.max(0, Duration.between(createdAt, reference).toMillis() / 1000.0);
        return Math.pow(0.5, ageSeconds / halfLifeSeconds);
    }

    double similarity(MemoryItem item, String query, Set<String> queryTokens) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> itemTokens = tokenize(item.getContent());
        item.getTags().forEach(tag -> itemTokens.addAll(tokenize(tag)));

        long matches = queryTokens.stream().filter(itemTokens::contains).count();
        double score = (double) matches / queryTokens.size();

        String normalizedQuery = query.trim().toLowerCase(Locale.ROOT);
        if (!normalizedQuery.isEmpty() && item.getContent() != null
                && item.getContent().toLowerCase(Locale.ROOT).contains(normalizedQuery)) {
            score += PHRASE_BONUS;
        }
        return Math.min(1.0, score);
    }

    /**
     * Lower-cased alphanumeric tokens of at least two characters, in order of first appearance.
     */
    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= 2) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
