package com.powerguard.anomaly.service;

import com.powerguard.anomaly.model.IngestionResponse;
import com.powerguard.anomaly.model.Reading;
import com.powerguard.anomaly.repository.AnomalyResultRepository;
import com.powerguard.anomaly.repository.DetectionRunRepository;
import com.powerguard.anomaly.repository.ReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Accepts already-parsed readings. Invalid rows are rejected individually and counted.
 */
@Service
public class ReadingIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ReadingIngestionService.class);

    private final ReadingRepository readingRepository;
    private final AnomalyResultRepository resultRepository;
    private final DetectionRunRepository runRepository;

    public ReadingIngestionService(ReadingRepository readingRepository,
                                   AnomalyResultRepository resultRepository,
                                   DetectionRunRepository runRepository) {
        this.readingRepository = readingRepository;
        this.resultRepository = resultRepository;
        this.runRepository = runRepository;
    }

    public IngestionResponse ingest(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            throw new IllegalArgumentException("No readings supplied");
        }
        List<Reading> accepted = new ArrayList<>(readings.size());
        Set<String> meters = new HashSet<>();
        int rejected = 0;
        for (Reading reading : readings) {
            String problem = validate(reading);
            if (problem != null) {
                rejected++;
                log.debug("Rejected reading {}: {}", reading, problem);
                continue;
            }
            accepted.add(reading);
            meters.add(reading.getMeterId());
        }

        if (!accepted.isEmpty()) {
            readingRepository.saveAll(accepted);
        }
        log.info("Ingested {} readings for {} meters, rejected {}", accepted.size(), meters.size(), rejected);

        return IngestionResponse.builder()
                .success(!accepted.isEmpty())
                .message("Stored " + accepted.size() + " readings for " + meters.size() + " meters")
                .metersCount(meters.size())
                .readingsCount(accepted.size())
                .rejectedCount(rejected)
                .build();
    }

    /**
     * Removes readings, meters, results and run summaries.
     */
    public void clearAll() {
        resultRepository.deleteAll();
        runRepository.deleteAll();
        readingRepository.deleteAll();
        log.warn("All stored data cleared");
    }

    private static String validate(Reading reading) {
        if (reading == null) return "null reading";
        if (reading.getMeterId() == null || reading.getMeterId().isBlank()) return "missing meter_id";
        if (reading.getTimestamp() == null) return "missing timestamp";
        double kwh = reading.getConsumptionKwh();
        if (!Double.isFinite(kwh) || kwh < 0.0) return "consumption_kwh must be a finite non-negative number";
        return null;
    }
}
