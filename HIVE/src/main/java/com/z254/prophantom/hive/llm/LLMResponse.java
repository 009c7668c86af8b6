package com.z254.prophantom.hive.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * Response object from completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMResponse {

    private String model;

    private String providerId;

    /**
     * Generated content.
     */
    private String content;

    private FinishReason finishReason;

    /**
     * Token usage statistics.
     */
    private Usage usage;

    /**
     * Generation latency in milliseconds.
     */
    private Long latencyMs;

    /**
     * Confidence or quality signal in [0,1], when the backend reports one.
     */
    private Double confidence;

    public enum FinishReason {
        STOP,
        /** Hit the token limit. */
        LENGTH
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        private int promptTokens;
        private int completionTokens;
        private int totalTokens;
    }

    public boolean isTruncated() {
        return finishReason == FinishReason.LENGTH;
    }

    public int getTotalTokens() {
        return usage != null ? usage.getTotalTokens() : 0;
    }

    /**
     * Create a simple text response.
     */
    public static LLMResponse text(String content, String model, String providerId) {
        return LLMResponse.builder()
                .content(content)
                .model(model)
                .providerId(providerId)
                .finishReason(FinishReason.STOP)
                .build();
    }
}
