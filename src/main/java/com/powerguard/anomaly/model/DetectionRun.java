package com.powerguard.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of one completed detection run")
public class DetectionRun {

    @Schema(description = "Run identifier", example = "4f1c2a9e-5a53-4d0e-9a53-2d0f5b8d4f11")
    private String runId;

    @Schema(description = "Detector used", example = "isolation_forest")
    private ModelType model;

    @Schema(description = "Suspicion threshold applied", example = "0.5")
    private double threshold;

    @Schema(description = "Explicitly requested meter ids; null when all meters were requested")
    private List<String> requestedMeterIds;

    private Instant startedAt;

    private Instant completedAt;

    @Schema(description = "Meters with enough readings whose result was persisted", example = "48")
    private int metersAnalyzed;

    @Schema(description = "Meters skipped for insufficient data", example = "2")
    private int metersSkipped;

    @Schema(description = "Meters scored but whose result could not be written", example = "0")
    private int failedWrites;

    @Schema(description = "Persisted results flagged suspicious", example = "7")
    private int suspiciousCount;

    private int criticalCount;

    private int highCount;

    private int mediumCount;

    private int lowCount;
}
