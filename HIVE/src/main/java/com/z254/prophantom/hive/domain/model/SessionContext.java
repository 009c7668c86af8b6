package com.z254.prophantom.hive.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Routing context of an inbound turn, as resolved by the dispatcher.
 */
@Value
@Builder
public class SessionContext {
    String userId;
    String agentType;
    String connectionId;
    @Singular("attribute")
    Map<String, Object> attributes;
}
