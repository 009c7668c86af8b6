package com.z254.prophantom.hive.agent;

import com.z254.prophantom.hive.domain.model.AgentSession;
import com.z254.prophantom.hive.domain.model.ContextSnapshot;
import com.z254.prophantom.hive.domain.model.ScoredMemory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the context snapshot for one turn, trimming the lowest-ranked memories
 * until the rendered block fits the token budget.
 */
@Component
public class ContextAssembler {

    static final String HEADER = "Relevant memories about this user:";
    static final String CONTEXT_HEADER = "Conversation context:";

    public ContextSnapshot assemble(AgentSession session, String userMessage, List<ScoredMemory> ranked,
                                    Map<String, Object> attributes, int tokenBudget, Instant now) {
        List<ScoredMemory> selected = new ArrayList<>(ranked);
        String rendered = render(selected, attributes);
        while (!selected.isEmpty() && estimateTokens(rendered) > tokenBudget) {
            selected.remove(selected.size() - 1);
            rendered = render(selected, attributes);
        }

        return ContextSnapshot.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .userId(session.getUserId())
                .agentType(session.getAgentType())
                .userMessage(userMessage)
                .items(selected)
                .summary(rendered)
                .estimatedTokens(estimateTokens(rendered))
                .tokenBudget(tokenBudget)
                .trimmedCount(ranked.size() - selected.size())
                .createdAt(now)
                .build();
    }

    /**
     * About four characters per token.
     */
    static int estimateTokens(String text) {
        return text == null || text.isEmpty() ? 0 : (int) Math.ceil(text.length() / 4.0);
    }

    private String render(List<ScoredMemory> selected, Map<String, Object> attributes) {
        StringBuilder block = new StringBuilder();
        if (!selected.isEmpty()) {
            block.append(HEADER);
            for (ScoredMemory scored : selected) {
                block.append("\n- (")
                        .append(scored.getItem().getKind().name().toLowerCase(Locale.ROOT))
                        .append(") ")
                        .append(scored.getItem().getContent());
            }
        }
        if (attributes != null && !attributes.isEmpty()) {
            if (block.length() > 0) {
                block.append("\n\n");
            }
            block.append(CONTEXT_HEADER);
            attributes.forEach((key, value) -> block.append("\n- ").append(key).append(": ").append(value));
        }
        return block.toString();
    }
}
