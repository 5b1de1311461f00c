package com.powerguard.anomaly.exception;

/**
 * A single record could not be persisted. The store itself is still reachable.
 */
public class StoreWriteException extends DetectionException {

    private final String recordKey;

    public StoreWriteException(String recordKey, Throwable cause) {
        super("STORE_WRITE_FAILED", "Failed to write record " + recordKey + ": " + cause.getMessage(), cause);
        this.recordKey = recordKey;
    }

    public String getRecordKey() { return recordKey; }
}
