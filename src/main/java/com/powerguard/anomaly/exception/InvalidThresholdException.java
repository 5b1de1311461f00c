package com.powerguard.anomaly.exception;

public class InvalidThresholdException extends DetectionException {

    private final double threshold;

    public InvalidThresholdException(double threshold) {
        super("INVALID_THRESHOLD", "Threshold must be within [0, 1], got " + threshold);
        this.threshold = threshold;
    }

    public double getThreshold() { return threshold; }
}
