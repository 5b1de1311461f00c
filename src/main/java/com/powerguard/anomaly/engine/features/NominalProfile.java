package com.powerguard.anomaly.engine.features;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Feature vector of a household with no time-of-use bias: flat consumption at the batch's median
 * level, every hour and every weekday weighted equally.
 *
 * Used as a reference point by the isolation forest and the explanation baseline. In very small
 * batches every meter is otherwise equally "isolated" and equally far from the mean.
 */
@Component
public class NominalProfile {

    private final FeatureExtractor extractor;

    public NominalProfile(FeatureExtractor extractor) {
        this.extractor = extractor;
    }

    public FeatureVector anchorFor(List<FeatureVector> batch) {
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a nominal profile for an empty batch");
        }
        return FeatureVector.builder()
                .hourlyAvg(median(batch))
                .dailyVariance(0.0)
                .nightRatio(extractor.nightHourCount() / 24.0)
                .peakRatio(extractor.peakHourCount() / 24.0)
                .weekendRatio(2.0 / 7.0)
                .build();
    }

    private static double median(List<FeatureVector> batch) {
        double[] values = batch.stream().mapToDouble(FeatureVector::getHourlyAvg).toArray();
        Arrays.sort(values);
        int mid = values.length / 2;
        return values.length % 2 == 1 ? values[mid] : (values[mid - 1] + values[mid]) / 2.0;
    }
}
