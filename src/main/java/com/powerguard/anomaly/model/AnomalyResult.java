package com.powerguard.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.powerguard.anomaly.engine.features.FeatureVector;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Current anomaly assessment of a meter. A newer detection run replaces it.")
public class AnomalyResult {

    @Schema(description = "Meter identifier", example = "MTR-0007")
    private String meterId;

    @Schema(description = "Batch-normalized anomaly score in [0,1]", example = "0.83")
    private double anomalyScore;

    @Schema(description = "Risk tier: low [0,0.25), medium [0.25,0.5), high [0.5,0.75), critical [0.75,1]",
            example = "critical")
    private RiskLevel riskLevel;

    @JsonProperty("is_suspicious")
    @Schema(description = "True when the score reaches the run's suspicion threshold", example = "true")
    private boolean suspicious;

    @Schema(description = "Human-readable justification",
            example = "Unusually high night-time usage relative to peers (night_ratio z=+2.31).")
    private String explanation;

    @Schema(description = "Detector that produced the score", example = "isolation_forest")
    private ModelType modelUsed;

    @Schema(description = "Detection run that produced this result")
    private String runId;

    @Schema(description = "Feature vector the score was computed from")
    private FeatureVector features;

    @Schema(description = "When the result was computed")
    private Instant computedAt;
}
