package com.powerguard.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

    private boolean success;

    private String message;

    private int metersCount;

    private int readingsCount;

    private int rejectedCount;
}
