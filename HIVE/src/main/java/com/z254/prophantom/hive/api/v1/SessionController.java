package com.z254.prophantom.hive.api.v1;

import com.z254.prophantom.hive.agent.TierPolicy;
import com.z254.prophantom.hive.api.dto.SessionView;
import com.z254.prophantom.hive.common.exception.NotFoundException;
import com.z254.prophantom.hive.domain.model.AgentSession;
import com.z254.prophantom.hive.domain.model.SessionTier;
import com.z254.prophantom.hive.domain.repository.AgentSessionRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.OptionalLong;

/**
 * REST controller for agent sessions and relationship tiers.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@Tag(name = "Sessions", description = "Per user and agent sessions")
public class SessionController {

    private final AgentSessionRepository sessionRepository;
    private final TierPolicy tierPolicy;

    public SessionController(AgentSessionRepository sessionRepository, TierPolicy tierPolicy) {
        this.sessionRepository = sessionRepository;
        this.tierPolicy = tierPolicy;
    }

    @GetMapping("/{userId}")
    @Operation(summary = "List sessions", description = "List every session of a user")
    @ApiResponse(responseCode = "200", description = "Sessions retrieved")
    public Flux<SessionView> listSessions(@Parameter(description = "User ID") @PathVariable String userId) {
        return Flux.defer(() -> Flux.fromIterable(sessionRepository.findByUser(userId)))
                .map(this::toView);
    }

    @GetMapping("/{userId}/{agentType}")
    @Operation(summary = "Get session", description = "Get the session with tier and next milestone")
    @ApiResponse(responseCode = "200", description = "Session found")
    @ApiResponse(responseCode = "404", description = "No session yet")
    public Mono<SessionView> getSession(
            @Parameter(description = "User ID") @PathVariable String userId,
            @Parameter(description = "Agent type") @PathVariable String agentType) {
        return Mono.fromCallable(() -> sessionRepository.findByUserAndAgent(userId, agentType)
                .map(this::toView)
                .orElseThrow(() -> new NotFoundException(
                        "No session for user " + userId + " and agent " + agentType)));
    }

    SessionView toView(AgentSession session) {
        long count = session.getInteractionCount();
        OptionalLong milestone = tierPolicy.nextMilestone(count);
        OptionalLong tierThreshold = tierPolicy.nextTierThreshold(count);
        return SessionView.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .agentType(session.getAgentType())
                .interactionCount(count)
                .tier(session.getTier().getName())
                .tierLevel(session.getTier().getLevel())
                .createdAt(session.getCreatedAt())
                .lastActivityAt(session.getLastActivityAt())
                .archived(session.isArchived())
                .nextMilestone(milestone.isPresent() ? milestone.getAsLong() : null)
                .interactionsToNextMilestone(milestone.isPresent() ? milestone.getAsLong() - count : null)
                .nextTier(tierPolicy.nextTier(count).map(SessionTier::getName).orElse(null))
                .nextTierThreshold(tierThreshold.isPresent() ? tierThreshold.getAsLong() : null)
                .build();
    }
}
