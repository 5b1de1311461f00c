package com.powerguard.anomaly.service;

import com.powerguard.anomaly.engine.MeterExtraction;
import com.powerguard.anomaly.engine.features.FeatureExtractor;
import com.powerguard.anomaly.model.AnomalyResult;
import com.powerguard.anomaly.model.MeterAnalysis;
import com.powerguard.anomaly.model.MeterSummary;
import com.powerguard.anomaly.model.MeterTimeSeries;
import com.powerguard.anomaly.model.Reading;
import com.powerguard.anomaly.model.ReadingPoint;
import com.powerguard.anomaly.repository.AnomalyResultRepository;
import com.powerguard.anomaly.repository.ReadingRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class MeterService {

    private final ReadingRepository readingRepository;
    private final AnomalyResultRepository resultRepository;
    private final FeatureExtractor featureExtractor;

    public MeterService(ReadingRepository readingRepository,
                        AnomalyResultRepository resultRepository,
                        FeatureExtractor featureExtractor) {
        this.readingRepository = readingRepository;
        this.resultRepository = resultRepository;
        this.featureExtractor = featureExtractor;
    }

    public List<String> listMeterIds() {
        return readingRepository.findAllMeterIds();
    }

    /**
     * Registered meters in id order, at most {@code limit} of them.
     */
    public List<MeterSummary> listMeters(int limit) {
        if (limit < 1 || limit > AnomalyQueryService.MAX_LIMIT) {
            throw new IllegalArgumentException(
                    "limit must be within 1-" + AnomalyQueryService.MAX_LIMIT + ", got " + limit);
        }
        return readingRepository.findAllMeters().stream().limit(limit).toList();
    }

    /**
     * The meter's readings in timestamp order with its stored result and current features.
     * When the stored result is suspicious, readings above mean + 2 standard deviations
     * (twice the mean for a constant series) are marked. Empty when the meter has no readings.
     */
    public Optional<MeterTimeSeries> getTimeSeries(String meterId) {
        List<Reading> readings = readingRepository.findByMeterId(meterId);
        if (readings == null || readings.isEmpty()) {
            return Optional.empty();
        }
        AnomalyResult result = resultRepository.findByMeterId(meterId).orElse(null);
        double cutoff = result != null && result.isSuspicious()
                ? spikeCutoff(readings)
                : Double.POSITIVE_INFINITY;

        List<ReadingPoint> points = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            points.add(ReadingPoint.builder()
                    .timestamp(reading.getTimestamp())
                    .consumptionKwh(reading.getConsumptionKwh())
                    .anomaly(reading.getConsumptionKwh() > cutoff)
                    .build());
        }
        return Optional.of(MeterTimeSeries.builder()
                .meterId(meterId)
                .readings(points)
                .anomalyResult(result)
                .stats(featureExtractor.tryExtract(meterId, readings).features())
                .build());
    }

    private static double spikeCutoff(List<Reading> readings) {
        double mean = readings.stream().mapToDouble(Reading::getConsumptionKwh).average().orElse(0.0);
        double variance = readings.stream()
                .mapToDouble(r -> (r.getConsumptionKwh() - mean) * (r.getConsumptionKwh() - mean))
                .average()
                .orElse(0.0);
        double std = Math.sqrt(variance);
        return std > 0.0 ? mean + 2.0 * std : mean * 2.0;
    }

    /**
     * Features recomputed from the meter's current readings, next to its stored result.
     * Empty when the meter has no readings at all.
     */
    public Optional<MeterAnalysis> analyze(String meterId) {
        List<Reading> readings = readingRepository.findByMeterId(meterId);
        if (readings == null || readings.isEmpty()) {
            return Optional.empty();
        }
        MeterExtraction extraction = featureExtractor.tryExtract(meterId, readings);
        return Optional.of(MeterAnalysis.builder()
                .meterId(meterId)
                .readingsCount(readings.size())
                .features(extraction.features())
                .anomalyResult(resultRepository.findByMeterId(meterId).orElse(null))
                .build());
    }
}
