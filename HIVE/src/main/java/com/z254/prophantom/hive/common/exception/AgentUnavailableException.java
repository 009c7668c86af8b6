package com.z254.prophantom.hive.common.exception;

public class AgentUnavailableException extends HiveException {

    public AgentUnavailableException(String agentType, Throwable cause) {
        super(ErrorKind.AGENT_UNAVAILABLE, "Agent " + agentType + " is temporarily unavailable", cause);
    }
}
