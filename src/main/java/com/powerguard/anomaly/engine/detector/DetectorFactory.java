package com.powerguard.anomaly.engine.detector;

import com.powerguard.anomaly.config.DetectionConfig;
import com.powerguard.anomaly.engine.detector.autoencoder.AutoencoderDetector;
import com.powerguard.anomaly.engine.detector.isolationforest.IsolationForestDetector;
import com.powerguard.anomaly.engine.features.NominalProfile;
import com.powerguard.anomaly.model.ModelType;
import org.springframework.stereotype.Component;

/**
 * Builds a new detector per run. Detectors and their trained state are never shared between runs.
 */
@Component
public class DetectorFactory {

    private final DetectionConfig config;
    private final NominalProfile nominalProfile;

    public DetectorFactory(DetectionConfig config, NominalProfile nominalProfile) {
        this.config = config;
        this.nominalProfile = nominalProfile;
    }

    public DetectorModel<?> create(ModelType type) {
        switch (type) {
            case ISOLATION_FOREST:
                return new IsolationForestDetector(config.getIsolationForest(), nominalProfile);
            case AUTOENCODER:
                return new AutoencoderDetector(config.getAutoencoder());
            default:
                throw new IllegalArgumentException("No detector for model type " + type);
        }
    }
}
