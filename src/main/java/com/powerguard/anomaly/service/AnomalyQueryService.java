package com.powerguard.anomaly.service;

import com.powerguard.anomaly.model.AnomalyResult;
import com.powerguard.anomaly.model.DashboardStats;
import com.powerguard.anomaly.model.DetectionRun;
import com.powerguard.anomaly.model.RiskLevel;
import com.powerguard.anomaly.repository.AnomalyResultRepository;
import com.powerguard.anomaly.repository.DetectionRunRepository;
import com.powerguard.anomaly.repository.ReadingRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read side over the current result set. Never triggers a detection run.
 */
@Service
public class AnomalyQueryService {

    public static final int MAX_LIMIT = 1000;

    private final AnomalyResultRepository resultRepository;
    private final DetectionRunRepository runRepository;
    private final ReadingRepository readingRepository;

    public AnomalyQueryService(AnomalyResultRepository resultRepository,
                               DetectionRunRepository runRepository,
                               ReadingRepository readingRepository) {
        this.resultRepository = resultRepository;
        this.runRepository = runRepository;
        this.readingRepository = readingRepository;
    }

    /**
     * Current results by descending score.
     */
    public List<AnomalyResult> getResults(boolean suspiciousOnly, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be within 1-" + MAX_LIMIT + ", got " + limit);
        }
        return resultRepository.findAll().stream()
                .filter(r -> !suspiciousOnly || r.isSuspicious())
                .limit(limit)
                .toList();
    }

    public Optional<AnomalyResult> getMeterResult(String meterId) {
        return resultRepository.findByMeterId(meterId);
    }

    public Optional<DetectionRun> getLatestRun() {
        return runRepository.findLatest();
    }

    public Optional<DetectionRun> getRun(String runId) {
        return runRepository.findById(runId);
    }

    public DashboardStats getStats() {
        List<AnomalyResult> results = resultRepository.findAll();
        long totalMeters = readingRepository.countMeters();

        long suspicious = results.stream().filter(AnomalyResult::isSuspicious).count();
        long highRisk = results.stream()
                .filter(r -> r.getRiskLevel() == RiskLevel.HIGH || r.getRiskLevel() == RiskLevel.CRITICAL)
                .count();
        long mediumRisk = results.stream().filter(r -> r.getRiskLevel() == RiskLevel.MEDIUM).count();
        long lowRisk = results.stream().filter(r -> r.getRiskLevel() == RiskLevel.LOW).count();
        Instant lastDetection = results.stream()
                .map(AnomalyResult::getComputedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);

        double percentage = totalMeters > 0 ? suspicious * 100.0 / totalMeters : 0.0;

        return DashboardStats.builder()
                .totalMeters(totalMeters)
                .totalReadings(readingRepository.countReadings())
                .suspiciousMeters(suspicious)
                .suspiciousPercentage(Math.round(percentage * 100.0) / 100.0)
                .highRiskCount(highRisk)
                .mediumRiskCount(mediumRisk)
                .lowRiskCount(lowRisk)
                .lastDetection(lastDetection)
                .build();
    }
}
