package com.powerguard.anomaly.exception;

/**
 * Base of the engine's failure taxonomy. The code is surfaced to API callers.
 */
public abstract class DetectionException extends RuntimeException {

    private final String code;

    protected DetectionException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected DetectionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
