package com.powerguard.anomaly.controller;

import com.powerguard.anomaly.model.IngestionResponse;
import com.powerguard.anomaly.model.Reading;
import com.powerguard.anomaly.service.ReadingIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/readings")
@Tag(name = "Readings", description = "Ingest and clear meter readings")
public class ReadingController {

    private final ReadingIngestionService ingestionService;

    public ReadingController(ReadingIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Operation(summary = "Ingest readings",
            description = "Stores a batch of readings. A reading for an existing (meter_id, timestamp) replaces it. " +
                    "Rows with a missing meter_id or timestamp, or a negative consumption, are rejected and counted.")
    @PostMapping
    public ResponseEntity<IngestionResponse> ingest(@RequestBody List<Reading> readings) {
        return ResponseEntity.ok(ingestionService.ingest(readings));
    }

    @Operation(summary = "Clear all data", description = "Deletes readings, meters, anomaly results and run summaries.")
    @DeleteMapping
    public ResponseEntity<Void> clear() {
        ingestionService.clearAll();
        return ResponseEntity.noContent().build();
    }
}
