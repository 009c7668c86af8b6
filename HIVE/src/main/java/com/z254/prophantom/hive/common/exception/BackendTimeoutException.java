package com.z254.prophantom.hive.common.exception;

import java.time.Duration;

public class BackendTimeoutException extends HiveException {

    public BackendTimeoutException(String agentType, Duration timeout) {
        super(ErrorKind.BACKEND_TIMEOUT,
                "Agent " + agentType + " did not answer within " + timeout.toMillis() + "ms");
    }
}
