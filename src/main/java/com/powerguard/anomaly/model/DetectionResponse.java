package com.powerguard.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a detection run")
public class DetectionResponse {

    private boolean success;

    @Schema(example = "Analyzed 48 meters, found 7 suspicious")
    private String message;

    private String runId;

    private int metersAnalyzed;

    private int metersSkipped;

    private int suspiciousCount;

    public static DetectionResponse from(DetectionRun run) {
        return DetectionResponse.builder()
                .success(true)
                .message("Analyzed " + run.getMetersAnalyzed() + " meters, found "
                        + run.getSuspiciousCount() + " suspicious")
                .runId(run.getRunId())
                .metersAnalyzed(run.getMetersAnalyzed())
                .metersSkipped(run.getMetersSkipped())
                .suspiciousCount(run.getSuspiciousCount())
                .build();
    }
}
