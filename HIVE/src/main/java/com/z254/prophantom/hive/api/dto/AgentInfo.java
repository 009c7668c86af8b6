package com.z254.prophantom.hive.api.dto;

import com.z254.prophantom.hive.domain.model.AgentProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of a configured agent profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentInfo {

    private String agentType;
    private String displayName;
    private String provider;
    private String model;
    private double temperature;
    private int workers;
    private int queueCapacity;
    private int inFlight;

    public static AgentInfo from(String agentType, AgentProfile profile, int inFlight) {
        return AgentInfo.builder()
                .agentType(agentType)
                .displayName(profile.getDisplayName() != null ? profile.getDisplayName() : agentType)
                .provider(profile.getProvider())
                .model(profile.getModel())
                .temperature(profile.getTemperature())
                .workers(profile.getWorkers())
                .queueCapacity(profile.getQueueCapacity())
                .inFlight(inFlight)
                .build();
    }
}
