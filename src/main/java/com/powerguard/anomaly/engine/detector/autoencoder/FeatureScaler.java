package com.powerguard.anomaly.engine.detector.autoencoder;

import java.util.Arrays;

/**
 * Per-column z-score standardization fitted on the training matrix.
 * Columns with zero spread are centered but not scaled.
 */
public final class FeatureScaler {

    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static FeatureScaler fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on zero rows");
        }
        int cols = data[0].length;
        double[] means = new double[cols];
        double[] scales = new double[cols];
        for (double[] row : data) {
            for (int j = 0; j < cols; j++) means[j] += row[j];
        }
        for (int j = 0; j < cols; j++) means[j] /= data.length;
        for (double[] row : data) {
            for (int j = 0; j < cols; j++) {
                double d = row[j] - means[j];
                scales[j] += d * d;
            }
        }
        for (int j = 0; j < cols; j++) {
            double sd = Math.sqrt(scales[j] / data.length);
            scales[j] = sd > 0.0 ? sd : 1.0;
        }
        return new FeatureScaler(means, scales);
    }

    public double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - means[j]) / scales[j];
        }
        return out;
    }

    public double[][] transform(double[][] data) {
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) out[i] = transform(data[i]);
        return out;
    }

    double[] getMeans() { return Arrays.copyOf(means, means.length); }
    double[] getScales() { return Arrays.copyOf(scales, scales.length); }
}
