package com.z254.prophantom.hive.common.exception;

/**
 * Thrown when the reconnection grace window of a connection has lapsed.
 */
public class SessionExpiredException extends HiveException {

    public SessionExpiredException(String connectionId) {
        super(ErrorKind.SESSION_EXPIRED, "Connection " + connectionId + " expired, open a new session");
    }
}
