package com.powerguard.anomaly.exception;

public class UnknownModelException extends DetectionException {

    private final String modelId;

    public UnknownModelException(String modelId) {
        super("UNKNOWN_MODEL", "Unknown model: " + modelId
                + ". Supported models: isolation_forest, autoencoder");
        this.modelId = modelId;
    }

    public String getModelId() { return modelId; }
}
