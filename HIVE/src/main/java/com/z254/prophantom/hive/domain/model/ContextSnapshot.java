package com.z254.prophantom.hive.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable capture of the memory excerpt used to answer one request.
 */
@Value
@Builder
public class ContextSnapshot {

    String id;

    String sessionId;

    String userId;

    String agentType;

    String userMessage;

    /**
     * Selected items in rank order, after trimming to the budget.
     */
    @Singular
    List<ScoredMemory> items;

    /**
     * Rendered memory block handed to the model.
     */
    String summary;

    int estimatedTokens;

    int tokenBudget;

    /**
     * Number of ranked items dropped to fit the budget.
     */
    int trimmedCount;

    Instant createdAt;
}
