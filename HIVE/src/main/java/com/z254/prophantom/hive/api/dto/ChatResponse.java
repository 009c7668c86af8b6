package com.z254.prophantom.hive.api.dto;

import com.z254.prophantom.hive.domain.model.AgentReply;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for the chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String sessionId;
    private String agentType;
    private String replyText;
    private String sessionTier;
    private int tierLevel;
    private long interactionCount;
    private long latencyMs;
    private Double confidence;

    public static ChatResponse fromReply(AgentReply reply) {
        return ChatResponse.builder()
                .sessionId(reply.getSessionId())
                .agentType(reply.getAgentType())
                .replyText(reply.getReplyText())
                .sessionTier(reply.getTier().getName())
                .tierLevel(reply.getTier().getLevel())
                .interactionCount(reply.getInteractionCount())
                .latencyMs(reply.getLatencyMs())
                .confidence(reply.getConfidence())
                .build();
    }
}
