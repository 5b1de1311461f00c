package com.powerguard.anomaly.engine.features;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-feature mean and population standard deviation, computed once per detection run.
 */
public final class PopulationBaseline {

    private final double[] means;
    private final double[] stdDevs;

    private PopulationBaseline(double[] means, double[] stdDevs) {
        this.means = means;
        this.stdDevs = stdDevs;
    }

    /**
     * Baseline over the batch plus the nominal reference vector.
     */
    public static PopulationBaseline of(List<FeatureVector> batch, FeatureVector reference) {
        List<FeatureVector> population = new ArrayList<>(batch);
        if (reference != null) {
            population.add(reference);
        }
        return of(population);
    }

    public static PopulationBaseline of(List<FeatureVector> population) {
        if (population.isEmpty()) {
            throw new IllegalArgumentException("Population must not be empty");
        }
        int n = population.size();
        double[] means = new double[Feature.COUNT];
        double[] stdDevs = new double[Feature.COUNT];

        for (FeatureVector v : population) {
            double[] values = v.toArray();
            for (int f = 0; f < Feature.COUNT; f++) means[f] += values[f];
        }
        for (int f = 0; f < Feature.COUNT; f++) means[f] /= n;

        for (FeatureVector v : population) {
            double[] values = v.toArray();
            for (int f = 0; f < Feature.COUNT; f++) {
                double d = values[f] - means[f];
                stdDevs[f] += d * d;
            }
        }
        for (int f = 0; f < Feature.COUNT; f++) stdDevs[f] = Math.sqrt(stdDevs[f] / n);

        return new PopulationBaseline(means, stdDevs);
    }

    public double mean(Feature feature) {
        return means[feature.ordinal()];
    }

    public double stdDev(Feature feature) {
        return stdDevs[feature.ordinal()];
    }

    /**
     * z-score of the value against the baseline; 0 when the feature does not vary.
     */
    public double zScore(Feature feature, double value) {
        double sd = stdDevs[feature.ordinal()];
        if (sd <= 0.0) return 0.0;
        return (value - means[feature.ordinal()]) / sd;
    }
}
