package com.z254.prophantom.hive.common.exception;

/**
 * Raised inside the memory store when a consolidation change set observes a
 * newer version of an item than the one it planned against. Never reaches callers.
 */
public class StoreConflictException extends HiveException {

    public StoreConflictException(String itemId, long expectedVersion, long actualVersion) {
        super(ErrorKind.STORE_CONFLICT,
                "Memory item " + itemId + " changed during consolidation (expected v"
                        + expectedVersion + ", found v" + actualVersion + ")");
    }
}
