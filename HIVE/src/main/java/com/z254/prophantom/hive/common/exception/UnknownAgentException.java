package com.z254.prophantom.hive.common.exception;

public class UnknownAgentException extends HiveException {

    public UnknownAgentException(String agentType) {
        super(ErrorKind.UNKNOWN_AGENT, "Unknown agent type: " + agentType);
    }
}
