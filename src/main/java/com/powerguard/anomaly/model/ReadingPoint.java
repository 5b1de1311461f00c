package com.powerguard.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
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
@Schema(description = "One point of a meter's consumption time series")
public class ReadingPoint {

    private LocalDateTime timestamp;

    private double consumptionKwh;

    @JsonProperty("is_anomaly")
    @Schema(description = "True for unusually high readings of a meter currently flagged suspicious")
    private boolean anomaly;
}
