package com.z254.prophantom.hive.llm;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the model sees for one turn.
 */
@Value
@Builder
public class PromptContext {
    String agentType;
    String userId;
    String systemPrompt;
    /**
     * Rendered memory excerpt from the context snapshot, may be empty.
     */
    String memoryContext;
    String userMessage;
}
