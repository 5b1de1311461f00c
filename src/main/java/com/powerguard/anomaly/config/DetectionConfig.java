package com.powerguard.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Suspicion threshold used when a run does not override it. Independent of the tier brackets.
    private double defaultThreshold = 0.5;

    // Meters with fewer readings are skipped. 24 = one day of hourly data.
    private int minReadings = 24;

    // Night window [start, end) in local hours. start > end wraps midnight.
    private int nightStartHour = 0;
    private int nightEndHour = 6;

    // Local hours counted as peak demand.
    private List<Integer> peakHours = List.of(18, 19, 20, 21);

    // Worker threads for per-meter extraction and result writes. 0 = available processors.
    private int workerThreads = 0;

    private IsolationForestSettings isolationForest = new IsolationForestSettings();

    private AutoencoderSettings autoencoder = new AutoencoderSettings();

    private ExplanationSettings explanation = new ExplanationSettings();

    @Data
    public static class IsolationForestSettings {
        private int numTrees = 100;
        private int sampleSize = 256;
        // Expected anomaly fraction; shifts the raw-score offset, not the ranking.
        private double contamination = 0.1;
        private long seed = 42L;
    }

    @Data
    public static class AutoencoderSettings {
        private int hiddenDim = 8;
        private int encodingDim = 3;
        private int epochs = 100;
        private int batchSize = 32;
        private double learningRate = 0.01;
        // Share of the batch farthest from the median left out of training, in [0, 0.5).
        private double trimFraction = 0.1;
        private long seed = 42L;
    }

    @Data
    public static class ExplanationSettings {
        // A second deviating feature is named only if its |z| reaches this value.
        private double secondaryMinZ = 1.0;
    }
}
