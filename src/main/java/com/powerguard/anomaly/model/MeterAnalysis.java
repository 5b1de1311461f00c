package com.powerguard.anomaly.model;

import com.powerguard.anomaly.engine.features.FeatureVector;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Feature breakdown and current result of one meter")
public class MeterAnalysis {

    private String meterId;

    private int readingsCount;

    @Schema(description = "Current features; null when the meter has too few readings")
    private FeatureVector features;

    private AnomalyResult anomalyResult;
}
