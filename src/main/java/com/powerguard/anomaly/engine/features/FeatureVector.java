package com.powerguard.anomaly.engine.features;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed-schema summary of one meter's reading history.
 * Ratios are shares of total consumption and lie in [0,1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Consumption features of one meter")
public class FeatureVector {

    @Schema(description = "Mean consumption per reading (kWh)", example = "0.92")
    private double hourlyAvg;

    @Schema(description = "Variance of per-day consumption totals (kWh^2)", example = "14.6")
    private double dailyVariance;

    @Schema(description = "Share of consumption inside the night window", example = "0.18")
    private double nightRatio;

    @Schema(description = "Share of consumption inside the peak hours", example = "0.27")
    private double peakRatio;

    @Schema(description = "Share of consumption on Saturday and Sunday", example = "0.29")
    private double weekendRatio;

    public double get(Feature feature) {
        switch (feature) {
            case HOURLY_AVG: return hourlyAvg;
            case DAILY_VARIANCE: return dailyVariance;
            case NIGHT_RATIO: return nightRatio;
            case PEAK_RATIO: return peakRatio;
            case WEEKEND_RATIO: return weekendRatio;
            default: throw new IllegalArgumentException("Unknown feature: " + feature);
        }
    }

    /**
     * Values in {@link Feature} declaration order.
     */
    @JsonIgnore
    public double[] toArray() {
        double[] values = new double[Feature.COUNT];
        for (Feature feature : Feature.values()) {
            values[feature.ordinal()] = get(feature);
        }
        return values;
    }
}
