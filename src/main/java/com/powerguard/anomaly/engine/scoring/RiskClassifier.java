package com.powerguard.anomaly.engine.scoring;

import com.powerguard.anomaly.exception.InvalidThresholdException;
import com.powerguard.anomaly.model.RiskLevel;
import org.springframework.stereotype.Component;

/**
 * Tier and suspicious flag for a normalized score.
 *
 * The tier brackets are fixed. The suspicious flag compares against the run's threshold only,
 * so a meter can sit in the high tier without being flagged.
 */
@Component
public class RiskClassifier {

    public record Classification(RiskLevel riskLevel, boolean suspicious) {}

    public Classification classify(double score, double threshold) {
        validateThreshold(threshold);
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new IllegalArgumentException("Normalized score must be within [0, 1], got " + score);
        }
        return new Classification(RiskLevel.fromScore(score), score >= threshold);
    }

    public static void validateThreshold(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new InvalidThresholdException(threshold);
        }
    }
}
