package com.powerguard.anomaly.model;

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
@Schema(description = "Aggregates over the current anomaly results and ingested data")
public class DashboardStats {

    private long totalMeters;

    private long totalReadings;

    private long suspiciousMeters;

    @Schema(description = "Suspicious meters as a percentage of all known meters", example = "14.0")
    private double suspiciousPercentage;

    @Schema(description = "Results in the high or critical tier")
    private long highRiskCount;

    private long mediumRiskCount;

    private long lowRiskCount;

    @Schema(description = "Most recent result computation time, null before the first run")
    private Instant lastDetection;
}
