package com.powerguard.anomaly.controller;

import com.powerguard.anomaly.model.MeterAnalysis;
import com.powerguard.anomaly.model.MeterSummary;
import com.powerguard.anomaly.model.MeterTimeSeries;
import com.powerguard.anomaly.service.MeterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/meters")
@Tag(name = "Meters", description = "Known meters and their feature breakdown")
public class MeterController {

    private final MeterService meterService;

    public MeterController(MeterService meterService) {
        this.meterService = meterService;
    }

    @Operation(summary = "List meters", description = "Registered meters in meter ID order.")
    @GetMapping
    public ResponseEntity<List<MeterSummary>> listMeters(
            @Parameter(description = "Maximum number of meters (1-1000)")
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(meterService.listMeters(limit));
    }

    @Operation(summary = "List meter IDs", description = "All meters with at least one ingested reading, sorted.")
    @GetMapping("/ids")
    public ResponseEntity<List<String>> listMeterIds() {
        return ResponseEntity.ok(meterService.listMeterIds());
    }

    @Operation(summary = "Get meter time series",
            description = "Readings in timestamp order with the current result and features. " +
                    "Unusually high readings are marked when the meter is flagged suspicious.")
    @GetMapping("/{meterId}")
    public ResponseEntity<MeterTimeSeries> getTimeSeries(
            @Parameter(description = "Meter ID", example = "MTR-0007")
            @PathVariable String meterId) {
        return meterService.getTimeSeries(meterId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Analyze a meter",
            description = "Recomputes the meter's features from its readings and returns them with its current result. " +
                    "Features are null when the meter has fewer readings than the detection minimum.")
    @GetMapping("/{meterId}/analysis")
    public ResponseEntity<MeterAnalysis> analyze(
            @Parameter(description = "Meter ID", example = "MTR-0007")
            @PathVariable String meterId) {
        return meterService.analyze(meterId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
