package com.powerguard.anomaly.exception;

public class InsufficientDataException extends DetectionException {

    private final String meterId;
    private final int readingCount;
    private final int minimumReadings;

    public InsufficientDataException(String meterId, int readingCount, int minimumReadings) {
        super("INSUFFICIENT_DATA", "Meter " + meterId + " has " + readingCount
                + " readings, at least " + minimumReadings + " required");
        this.meterId = meterId;
        this.readingCount = readingCount;
        this.minimumReadings = minimumReadings;
    }

    public String getMeterId() { return meterId; }
    public int getReadingCount() { return readingCount; }
    public int getMinimumReadings() { return minimumReadings; }
}
