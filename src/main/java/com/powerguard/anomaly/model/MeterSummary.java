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
@Schema(description = "A registered meter")
public class MeterSummary {

    @Schema(description = "Meter identifier", example = "MTR-0007")
    private String meterId;

    @Schema(description = "When the meter's first reading was ingested")
    private Instant registeredAt;
}
