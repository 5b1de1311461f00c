package com.powerguard.anomaly.exception;

public class EmptyBatchException extends DetectionException {

    private final int metersRequested;

    public EmptyBatchException(int metersRequested) {
        super("EMPTY_BATCH", "None of the " + metersRequested
                + " requested meters has enough readings to be analyzed");
        this.metersRequested = metersRequested;
    }

    public int getMetersRequested() { return metersRequested; }
}
