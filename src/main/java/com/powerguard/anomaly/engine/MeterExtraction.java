package com.powerguard.anomaly.engine;

import com.powerguard.anomaly.engine.features.FeatureVector;

/**
 * Outcome of the per-meter extraction stage: either a feature vector or the reason the meter was skipped.
 */
public record MeterExtraction(String meterId, int readingCount, FeatureVector features, String skipReason) {

    public static MeterExtraction extracted(String meterId, int readingCount, FeatureVector features) {
        return new MeterExtraction(meterId, readingCount, features, null);
    }

    public static MeterExtraction skipped(String meterId, int readingCount, String reason) {
        return new MeterExtraction(meterId, readingCount, null, reason);
    }

    public boolean isExtracted() {
        return features != null;
    }
}
