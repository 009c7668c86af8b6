package com.z254.prophantom.hive.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Session state with relationship progress.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionView {

    private String sessionId;
    private String userId;
    private String agentType;
    private long interactionCount;
    private String tier;
    private int tierLevel;
    private Instant createdAt;
    private Instant lastActivityAt;
    private boolean archived;

    /** Next milestone count, null once all milestones are passed. */
    private Long nextMilestone;
    private Long interactionsToNextMilestone;
    private String nextTier;
    private Long nextTierThreshold;
}
