package com.z254.prophantom.hive.agent;

import com.z254.prophantom.hive.common.exception.UnknownAgentException;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.AgentProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Holds exactly one runtime per configured agent type.
 */
@Component
@Slf4j
public class AgentRuntimeRegistry {

    private final Map<String, AgentRuntime> runtimes = new LinkedHashMap<>();

    public AgentRuntimeRegistry(HiveProperties properties, AgentRuntimeContext runtimeContext) {
        properties.getAgents().forEach((agentType, profile) -> {
            runtimes.put(agentType, new AgentRuntime(agentType, profile, runtimeContext));
            log.info("Registered agent runtime for type: {} (model {})", agentType, profile.getModel());
        });
    }

    /**
     * @throws UnknownAgentException if no profile is configured for the type
     */
    public AgentRuntime getRuntime(String agentType) {
        AgentRuntime runtime = runtimes.get(agentType);
        if (runtime == null) {
            throw new UnknownAgentException(agentType);
        }
        return runtime;
    }

    public boolean hasRuntime(String agentType) {
        return runtimes.containsKey(agentType);
    }

    public AgentProfile getProfile(String agentType) {
        return getRuntime(agentType).getProfile();
    }

    public Set<String> getAgentTypes() {
        return Collections.unmodifiableSet(runtimes.keySet());
    }
}
