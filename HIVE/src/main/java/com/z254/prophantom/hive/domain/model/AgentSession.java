package com.z254.prophantom.hive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One logical conversation between a user and one agent type.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentSession {

    private String id;

    private String userId;

    private String agentType;

    private long interactionCount;

    /**
     * Never decreases.
     */
    private SessionTier tier;

    private Instant createdAt;

    private Instant lastActivityAt;

    private boolean archived;
}
