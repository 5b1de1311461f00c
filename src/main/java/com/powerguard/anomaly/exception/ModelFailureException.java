package com.powerguard.anomaly.exception;

/**
 * The selected detector could not fit or score the batch.
 */
public class ModelFailureException extends DetectionException {

    public ModelFailureException(String model, Throwable cause) {
        super("MODEL_FAILURE", "Detector " + model + " failed: " + cause.getMessage(), cause);
    }
}
