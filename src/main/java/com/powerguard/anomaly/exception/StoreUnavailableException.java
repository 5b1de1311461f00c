package com.powerguard.anomaly.exception;

public class StoreUnavailableException extends DetectionException {

    public StoreUnavailableException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", message, cause);
    }
}
