package com.powerguard.anomaly.model;

import com.powerguard.anomaly.engine.features.FeatureVector;
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
@Schema(description = "Consumption time series of one meter with its current result")
public class MeterTimeSeries {

    private String meterId;

    @Schema(description = "Readings in timestamp order")
    private List<ReadingPoint> readings;

    private AnomalyResult anomalyResult;

    @Schema(description = "Features computed from the readings; null when the meter has too few readings")
    private FeatureVector stats;
}
