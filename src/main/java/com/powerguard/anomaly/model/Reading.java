package com.powerguard.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single smart-meter consumption measurement")
public class Reading {

    @Schema(description = "Meter identifier", example = "MTR-0007")
    private String meterId;

    @Schema(description = "Naive local date-time of the measurement (no zone; bucketed as recorded)",
            example = "2025-01-14T02:00:00")
    private LocalDateTime timestamp;

    @Schema(description = "Energy consumed in the interval, in kWh", example = "1.25")
    private double consumptionKwh;
}
