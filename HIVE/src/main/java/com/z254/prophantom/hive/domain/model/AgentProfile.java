package com.z254.prophantom.hive.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Declarative configuration of one agent type.
 * All agents share the same runtime; only the profile differs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentProfile {

    private String displayName;

    /**
     * LLM provider id, defaults to the local model server.
     */
    @Builder.Default
    private String provider = "ollama";

    @NotBlank
    private String model;

    private String systemPrompt;

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private int maxTokens = 512;

    /**
     * Token budget for the memory context block.
     */
    @Builder.Default
    private int contextTokenBudget = 1024;

    /**
     * Number of memory items requested from the store per turn.
     */
    @Builder.Default
    private int memoryLimit = 5;

    /**
     * Concurrent backend calls allowed for this agent type.
     */
    @Min(1)
    @Builder.Default
    private int workers = 4;

    /**
     * Requests allowed to wait for a worker before admission rejects.
     */
    @Min(0)
    @Builder.Default
    private int queueCapacity = 16;

    /**
     * Per-attempt backend timeout. Falls back to the backend default when null.
     */
    private Duration timeout;
}
