package com.powerguard.anomaly.engine.detector.isolationforest;

import com.powerguard.anomaly.config.DetectionConfig;
import com.powerguard.anomaly.engine.detector.DetectorModel;
import com.powerguard.anomaly.engine.features.FeatureVector;
import com.powerguard.anomaly.engine.features.NominalProfile;
import com.powerguard.anomaly.model.ModelType;

import java.util.Arrays;
import java.util.List;

/**
 * Isolation Forest over the batch's feature vectors.
 *
 * Raw score = path-length score minus an offset, where the offset is the (1 - contamination)
 * quantile of the training scores. Positive raw scores mark the expected outlier fraction.
 * The offset shifts every score equally, so ranking is unaffected by contamination.
 */
public class IsolationForestDetector implements DetectorModel<IsolationForestDetector.TrainedForest> {

    public record TrainedForest(IsolationForest forest, double offset) {}

    private final DetectionConfig.IsolationForestSettings settings;
    private final NominalProfile nominalProfile;

    /**
     * @param nominalProfile reference vector added to the training set; null trains on the batch alone
     */
    public IsolationForestDetector(DetectionConfig.IsolationForestSettings settings, NominalProfile nominalProfile) {
        double contamination = settings.getContamination();
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("Contamination must be within (0, 0.5], got " + contamination);
        }
        if (settings.getNumTrees() < 1 || settings.getSampleSize() < 2) {
            throw new IllegalArgumentException("Isolation forest needs at least 1 tree and a sample size of 2");
        }
        this.settings = settings;
        this.nominalProfile = nominalProfile;
    }

    @Override
    public ModelType getType() {
        return ModelType.ISOLATION_FOREST;
    }

    @Override
    public TrainedForest fit(List<FeatureVector> batch) {
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit on an empty batch");
        }
        double[][] data = toMatrix(batch);
        double[][] training = data;
        if (nominalProfile != null) {
            training = Arrays.copyOf(data, data.length + 1);
            training[data.length] = nominalProfile.anchorFor(batch).toArray();
        }

        IsolationForest forest = new IsolationForest();
        forest.train(training, settings.getNumTrees(), settings.getSampleSize(), settings.getSeed());

        double[] trainingScores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            trainingScores[i] = forest.anomalyScore(data[i]);
        }
        double offset = quantile(trainingScores, 1.0 - settings.getContamination());
        return new TrainedForest(forest, offset);
    }

    @Override
    public double[] score(TrainedForest trained, List<FeatureVector> vectors) {
        double[] scores = new double[vectors.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = trained.forest().anomalyScore(vectors.get(i).toArray()) - trained.offset();
        }
        return scores;
    }

    /**
     * Linear-interpolation quantile, q in [0,1].
     */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) return sorted[lower];
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }

    private static double[][] toMatrix(List<FeatureVector> vectors) {
        double[][] data = new double[vectors.size()][];
        for (int i = 0; i < data.length; i++) {
            data[i] = vectors.get(i).toArray();
        }
        return data;
    }
}
