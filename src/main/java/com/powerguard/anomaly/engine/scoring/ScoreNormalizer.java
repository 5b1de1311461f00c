package com.powerguard.anomaly.engine.scoring;

import org.springframework.stereotype.Component;

/**
 * Min-max scaling of raw detector scores within one batch.
 * The batch minimum maps to 0 and the maximum to 1. A single score, or a batch of equal scores, maps to 0.
 */
@Component
public class ScoreNormalizer {

    public double[] normalize(double[] rawScores) {
        double[] normalized = new double[rawScores.length];
        if (rawScores.length == 0) return normalized;

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < rawScores.length; i++) {
            double s = rawScores[i];
            if (!Double.isFinite(s)) {
                throw new IllegalArgumentException("Raw score at index " + i + " is not finite: " + s);
            }
            if (s < min) min = s;
            if (s > max) max = s;
        }

        double range = max - min;
        if (rawScores.length == 1 || range <= 0.0) {
            return normalized;
        }
        for (int i = 0; i < rawScores.length; i++) {
            double v = (rawScores[i] - min) / range;
            normalized[i] = Math.max(0.0, Math.min(1.0, v));
        }
        return normalized;
    }
}
