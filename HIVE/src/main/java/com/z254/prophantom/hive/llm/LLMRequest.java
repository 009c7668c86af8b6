package com.z254.prophantom.hive.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request object for completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMRequest {

    /**
     * Model to use for completion.
     */
    private String model;

    /**
     * Messages for the conversation.
     */
    private List<Message> messages;

    /**
     * Temperature for sampling (0.0 - 2.0).
     */
    @Builder.Default
    private Double temperature = 0.7;

    /**
     * Maximum tokens to generate.
     */
    private Integer maxTokens;

    /**
     * User identifier for tracking.
     */
    private String user;

    /**
     * A message in the conversation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;  // system, user, assistant
        private String content;
    }

    public static Message systemMessage(String content) {
        return Message.builder()
                .role("system")
                .content(content)
                .build();
    }

    public static Message userMessage(String content) {
        return Message.builder()
                .role("user")
                .content(content)
                .build();
    }
}
