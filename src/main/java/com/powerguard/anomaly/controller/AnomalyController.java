package com.powerguard.anomaly.controller;

import com.powerguard.anomaly.model.AnomalyResult;
import com.powerguard.anomaly.model.DashboardStats;
import com.powerguard.anomaly.model.DetectionRequest;
import com.powerguard.anomaly.model.DetectionResponse;
import com.powerguard.anomaly.model.DetectionRun;
import com.powerguard.anomaly.service.AnomalyQueryService;
import com.powerguard.anomaly.service.DetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomaly")
@Tag(name = "Anomaly Detection", description = "Run batch detection and query per-meter anomaly results")
public class AnomalyController {

    private final DetectionService detectionService;
    private final AnomalyQueryService queryService;

    public AnomalyController(DetectionService detectionService, AnomalyQueryService queryService) {
        this.detectionService = detectionService;
        this.queryService = queryService;
    }

    @Operation(summary = "Run anomaly detection",
            description = "Extracts features for the requested meters (all meters when meter_ids is absent), " +
                    "fits the chosen model on the batch and replaces each meter's current result. " +
                    "Meters with too few readings are skipped.")
    @PostMapping("/detect")
    public ResponseEntity<DetectionResponse> detect(@RequestBody(required = false) DetectionRequest request) {
        DetectionRun run = detectionService.runDetection(request != null ? request : new DetectionRequest());
        return ResponseEntity.ok(DetectionResponse.from(run));
    }

    @Operation(summary = "List current anomaly results",
            description = "Current result per meter, highest anomaly score first.")
    @GetMapping("/results")
    public ResponseEntity<List<AnomalyResult>> getResults(
            @Parameter(description = "Only return meters flagged suspicious")
            @RequestParam(name = "suspicious_only", defaultValue = "false") boolean suspiciousOnly,
            @Parameter(description = "Maximum results, 1-1000", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queryService.getResults(suspiciousOnly, limit));
    }

    @Operation(summary = "Dashboard statistics",
            description = "Meter and reading totals plus suspicious and per-tier counts over the current results.")
    @GetMapping("/stats")
    public ResponseEntity<DashboardStats> getStats() {
        return ResponseEntity.ok(queryService.getStats());
    }

    @Operation(summary = "Get the current result of a meter")
    @GetMapping("/result/{meterId}")
    public ResponseEntity<AnomalyResult> getMeterResult(
            @Parameter(description = "Meter ID", example = "MTR-0007")
            @PathVariable String meterId) {
        return queryService.getMeterResult(meterId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Summary of the most recent detection run")
    @GetMapping("/runs/latest")
    public ResponseEntity<DetectionRun> getLatestRun() {
        return queryService.getLatestRun()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Summary of a detection run")
    @GetMapping("/runs/{runId}")
    public ResponseEntity<DetectionRun> getRun(@PathVariable String runId) {
        return queryService.getRun(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
