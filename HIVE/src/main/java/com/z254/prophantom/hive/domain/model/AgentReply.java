package com.z254.prophantom.hive.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one completed turn.
 */
@Value
@Builder
public class AgentReply {
    String sessionId;
    String agentType;
    String replyText;
    SessionTier tier;
    long interactionCount;
    long latencyMs;
    Double confidence;
    String snapshotId;
    String memoryItemId;
}
