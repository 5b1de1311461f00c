package com.powerguard.anomaly.engine.detector.autoencoder;

import com.powerguard.anomaly.config.DetectionConfig;
import com.powerguard.anomaly.engine.detector.DetectorModel;
import com.powerguard.anomaly.engine.features.Feature;
import com.powerguard.anomaly.engine.features.FeatureVector;
import com.powerguard.anomaly.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Reconstruction-error detector. Meters the network reproduces poorly score higher.
 *
 * The network learns the batch's normal consumption patterns: the meters farthest from the
 * per-feature median (a {@code trimFraction} share, at least one once the batch has three meters)
 * are left out of training but still scored. A meter the network never saw cannot be memorized,
 * so an isolated extreme meter keeps a large reconstruction error.
 */
public class AutoencoderDetector implements DetectorModel<AutoencoderDetector.TrainedNetwork> {

    private static final Logger log = LoggerFactory.getLogger(AutoencoderDetector.class);

    public record TrainedNetwork(FeatureScaler scaler, Autoencoder network) {}

    private final DetectionConfig.AutoencoderSettings settings;

    public AutoencoderDetector(DetectionConfig.AutoencoderSettings settings) {
        if (settings.getEpochs() < 1 || settings.getBatchSize() < 1 || !(settings.getLearningRate() > 0.0)) {
            throw new IllegalArgumentException("Autoencoder needs positive epochs, batch size and learning rate");
        }
        if (!(settings.getTrimFraction() >= 0.0 && settings.getTrimFraction() < 0.5)) {
            throw new IllegalArgumentException("Autoencoder trim fraction must be in [0, 0.5), got "
                    + settings.getTrimFraction());
        }
        this.settings = settings;
    }

    @Override
    public ModelType getType() {
        return ModelType.AUTOENCODER;
    }

    @Override
    public TrainedNetwork fit(List<FeatureVector> batch) {
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit on an empty batch");
        }
        double[][] raw = new double[batch.size()][];
        for (int i = 0; i < raw.length; i++) raw[i] = batch.get(i).toArray();

        FeatureScaler scaler = FeatureScaler.fit(raw);
        double[][] scaled = scaler.transform(raw);

        Autoencoder network = new Autoencoder(Feature.COUNT, settings.getHiddenDim(),
                settings.getEncodingDim(), settings.getSeed());
        double[][] training = trainingRows(scaled, settings.getTrimFraction());
        double loss = network.train(training, settings.getEpochs(), settings.getBatchSize(),
                settings.getLearningRate(), settings.getSeed());
        log.debug("Autoencoder trained on {} of {} meters, final epoch loss {}",
                training.length, batch.size(), loss);
        return new TrainedNetwork(scaler, network);
    }

    @Override
    public double[] score(TrainedNetwork trained, List<FeatureVector> vectors) {
        double[] scores = new double[vectors.size()];
        for (int i = 0; i < scores.length; i++) {
            double[] scaled = trained.scaler().transform(vectors.get(i).toArray());
            scores[i] = trained.network().reconstructionError(scaled);
        }
        return scores;
    }

    /**
     * Rows kept for training, in batch order. Drops the rows with the largest squared distance
     * from the per-feature median; equal distances drop the later row. At least two rows remain.
     */
    static double[][] trainingRows(double[][] scaled, double trimFraction) {
        int n = scaled.length;
        int trim = n < 3 || trimFraction == 0.0
                ? 0
                : Math.min(n - 2, Math.max(1, (int) Math.round(n * trimFraction)));
        if (trim == 0) {
            return scaled;
        }

        double[] median = columnMedians(scaled);
        double[] distance = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < median.length; j++) {
                double d = scaled[i][j] - median[j];
                distance[i] += d * d;
            }
        }

        boolean[] dropped = new boolean[n];
        IntStream.range(0, n).boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> distance[i]).reversed()
                        .thenComparing(Comparator.reverseOrder()))
                .limit(trim)
                .forEach(i -> dropped[i] = true);

        double[][] kept = new double[n - trim][];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (!dropped[i]) kept[k++] = scaled[i];
        }
        return kept;
    }

    private static double[] columnMedians(double[][] rows) {
        int cols = rows[0].length;
        double[] medians = new double[cols];
        double[] column = new double[rows.length];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < rows.length; i++) column[i] = rows[i][j];
            Arrays.sort(column);
            int mid = column.length / 2;
            medians[j] = column.length % 2 == 1 ? column[mid] : (column[mid - 1] + column[mid]) / 2.0;
        }
        return medians;
    }
}
