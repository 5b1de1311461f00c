package com.powerguard.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Parameters of a detection run")
public class DetectionRequest {

    @Builder.Default
    @Schema(description = "Detector to run", example = "isolation_forest",
            allowableValues = {"isolation_forest", "autoencoder"})
    private String model = ModelType.ISOLATION_FOREST.getId();

    @Schema(description = "Suspicion threshold in [0,1]; defaults to detection.default-threshold", example = "0.5")
    private Double threshold;

    @Schema(description = "Meters to analyze; all known meters when absent")
    private List<String> meterIds;
}
