package com.z254.prophantom.hive.api.v1;

import com.z254.prophantom.hive.agent.AgentRuntimeRegistry;
import com.z254.prophantom.hive.api.dto.AgentInfo;
import com.z254.prophantom.hive.dispatch.AdmissionController;
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

/**
 * REST controller for agent profiles.
 */
@RestController
@RequestMapping("/api/v1/agents")
@Tag(name = "Agents", description = "Configured agent types")
public class AgentController {

    private final AgentRuntimeRegistry runtimeRegistry;
    private final AdmissionController admissionController;

    public AgentController(AgentRuntimeRegistry runtimeRegistry, AdmissionController admissionController) {
        this.runtimeRegistry = runtimeRegistry;
        this.admissionController = admissionController;
    }

    @GetMapping
    @Operation(summary = "List agents", description = "List every configured agent type")
    @ApiResponse(responseCode = "200", description = "Agents retrieved")
    public Flux<AgentInfo> listAgents() {
        return Flux.fromIterable(runtimeRegistry.getAgentTypes())
                .map(this::toInfo);
    }

    @GetMapping("/{agentType}")
    @Operation(summary = "Get agent", description = "Get one agent profile")
    @ApiResponse(responseCode = "200", description = "Agent found")
    @ApiResponse(responseCode = "404", description = "Unknown agent type")
    public Mono<AgentInfo> getAgent(@Parameter(description = "Agent type") @PathVariable String agentType) {
        return Mono.fromCallable(() -> toInfo(agentType));
    }

    private AgentInfo toInfo(String agentType) {
        return AgentInfo.from(agentType, runtimeRegistry.getProfile(agentType),
                admissionController.inFlight(agentType));
    }
}
