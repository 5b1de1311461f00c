package com.powerguard.anomaly.service;

import com.powerguard.anomaly.config.DetectionConfig;
import com.powerguard.anomaly.config.MetricsConfig;
import com.powerguard.anomaly.engine.MeterExtraction;
import com.powerguard.anomaly.engine.detector.DetectorFactory;
import com.powerguard.anomaly.engine.detector.DetectorModel;
import com.powerguard.anomaly.engine.features.FeatureExtractor;
import com.powerguard.anomaly.engine.features.FeatureVector;
import com.powerguard.anomaly.engine.features.NominalProfile;
import com.powerguard.anomaly.engine.features.PopulationBaseline;
import com.powerguard.anomaly.engine.scoring.ExplanationGenerator;
import com.powerguard.anomaly.engine.scoring.RiskClassifier;
import com.powerguard.anomaly.engine.scoring.ScoreNormalizer;
import com.powerguard.anomaly.exception.DetectionException;
import com.powerguard.anomaly.exception.EmptyBatchException;
import com.powerguard.anomaly.exception.ModelFailureException;
import com.powerguard.anomaly.exception.StoreUnavailableException;
import com.powerguard.anomaly.exception.StoreWriteException;
import com.powerguard.anomaly.model.AnomalyResult;
import com.powerguard.anomaly.model.DetectionRequest;
import com.powerguard.anomaly.model.DetectionRun;
import com.powerguard.anomaly.model.ModelType;
import com.powerguard.anomaly.model.Reading;
import com.powerguard.anomaly.repository.AnomalyResultRepository;
import com.powerguard.anomaly.repository.DetectionRunRepository;
import com.powerguard.anomaly.repository.ReadingRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Drives a detection run over a set of meters.
 *
 * Flow:
 * 1. Validate model and threshold (before anything is read or written)
 * 2. Load readings for the requested meters, or for every known meter
 * 3. Extract features per meter on the worker pool; short histories are skipped
 * 4. Fit and score the whole batch with a freshly built detector
 * 5. Normalize, classify and explain each score
 * 6. Replace each meter's current result on the worker pool
 * 7. Finalize the run summary once every write has completed, then persist it
 *
 * The run fails for an unknown model, an invalid threshold, an empty batch, a detector that cannot
 * produce finite scores, or an unreachable store.
 * A single result that cannot be written is counted in failed_writes and the run continues.
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final ReadingRepository readingRepository;
    private final AnomalyResultRepository resultRepository;
    private final DetectionRunRepository runRepository;
    private final FeatureExtractor featureExtractor;
    private final NominalProfile nominalProfile;
    private final DetectorFactory detectorFactory;
    private final ScoreNormalizer scoreNormalizer;
    private final RiskClassifier riskClassifier;
    private final ExplanationGenerator explanationGenerator;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final ExecutorService workerPool;

    public DetectionService(ReadingRepository readingRepository,
                            AnomalyResultRepository resultRepository,
                            DetectionRunRepository runRepository,
                            FeatureExtractor featureExtractor,
                            NominalProfile nominalProfile,
                            DetectorFactory detectorFactory,
                            ScoreNormalizer scoreNormalizer,
                            RiskClassifier riskClassifier,
                            ExplanationGenerator explanationGenerator,
                            DetectionConfig config,
                            MetricsConfig metricsConfig,
                            Tracer tracer,
                            @Qualifier("detectionWorkerPool") ExecutorService workerPool) {
        this.readingRepository = readingRepository;
        this.resultRepository = resultRepository;
        this.runRepository = runRepository;
        this.featureExtractor = featureExtractor;
        this.nominalProfile = nominalProfile;
        this.detectorFactory = detectorFactory;
        this.scoreNormalizer = scoreNormalizer;
        this.riskClassifier = riskClassifier;
        this.explanationGenerator = explanationGenerator;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.workerPool = workerPool;
    }

    @Observed(name = "detection.run", contextualName = "run-detection")
    public DetectionRun runDetection(DetectionRequest request) {
        try {
            ModelType model = ModelType.fromId(request.getModel());
            double threshold = request.getThreshold() != null
                    ? request.getThreshold()
                    : config.getDefaultThreshold();
            RiskClassifier.validateThreshold(threshold);
            return execute(model, threshold, request.getMeterIds());
        } catch (DetectionException e) {
            metricsConfig.recordRunFailed(e.getCode());
            throw e;
        }
    }

    private DetectionRun execute(ModelType model, double threshold, List<String> requestedIds) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();

        // 1. Resolve the meter set
        List<String> requested = requestedIds == null ? null : new ArrayList<>(new LinkedHashSet<>(requestedIds));
        Map<String, List<Reading>> readingsByMeter = requested == null
                ? readingRepository.findAllGroupedByMeter()
                : readingRepository.findByMeterIds(requested);

        log.info("Detection run {} started: model={}, threshold={}, meters={}",
                runId, model.getId(), threshold, readingsByMeter.size());

        // 2. Per-meter feature extraction
        List<MeterExtraction> extractions = extractAll(readingsByMeter);
        List<MeterExtraction> valid = new ArrayList<>();
        int skipped = 0;
        for (MeterExtraction extraction : extractions) {
            if (extraction.isExtracted()) {
                valid.add(extraction);
            } else {
                skipped++;
                metricsConfig.recordMeterSkipped();
                log.warn("Run {} skipped meter {}: {}", runId, extraction.meterId(), extraction.skipReason());
            }
        }
        if (valid.isEmpty()) {
            throw new EmptyBatchException(readingsByMeter.size());
        }

        List<FeatureVector> batch = valid.stream().map(MeterExtraction::features).toList();

        // 3. Batch fit/score, single stage
        double[] rawScores = fitAndScore(model, batch);
        double[] scores;
        try {
            scores = scoreNormalizer.normalize(rawScores);
        } catch (IllegalArgumentException e) {
            throw new ModelFailureException(model.getId(), e);
        }

        // 4. Classification and explanation
        PopulationBaseline baseline = PopulationBaseline.of(batch, nominalProfile.anchorFor(batch));
        Instant computedAt = Instant.now();
        List<AnomalyResult> results = new ArrayList<>(valid.size());
        for (int i = 0; i < valid.size(); i++) {
            FeatureVector features = batch.get(i);
            RiskClassifier.Classification classification = riskClassifier.classify(scores[i], threshold);
            results.add(AnomalyResult.builder()
                    .meterId(valid.get(i).meterId())
                    .anomalyScore(scores[i])
                    .riskLevel(classification.riskLevel())
                    .suspicious(classification.suspicious())
                    .explanation(explanationGenerator.explain(features, baseline, classification.suspicious()))
                    .modelUsed(model)
                    .runId(runId)
                    .features(features)
                    .computedAt(computedAt)
                    .build());
        }

        // 5. Writes; the summary only counts acknowledged results
        List<AnomalyResult> persisted = writeAll(runId, results);

        DetectionRun run = summarize(runId, model, threshold, requested, startedAt,
                persisted, skipped, results.size() - persisted.size());

        try {
            runRepository.save(run);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (DetectionException e) {
            log.warn("Run {} completed but its summary could not be stored: {}", runId, e.getMessage());
        }

        metricsConfig.recordRun(run);
        log.info("Detection run {} completed: analyzed={}, skipped={}, suspicious={}, failedWrites={}",
                runId, run.getMetersAnalyzed(), run.getMetersSkipped(),
                run.getSuspiciousCount(), run.getFailedWrites());
        if (run.getCriticalCount() > 0) {
            log.warn("Run {} flagged {} meters as critical", runId, run.getCriticalCount());
        }
        return run;
    }

    private List<MeterExtraction> extractAll(Map<String, List<Reading>> readingsByMeter) {
        List<CompletableFuture<MeterExtraction>> futures = new ArrayList<>(readingsByMeter.size());
        readingsByMeter.forEach((meterId, readings) -> futures.add(
                CompletableFuture.supplyAsync(() -> featureExtractor.tryExtract(meterId, readings), workerPool)));

        List<MeterExtraction> extractions = new ArrayList<>(futures.size());
        for (CompletableFuture<MeterExtraction> future : futures) {
            try {
                extractions.add(future.join());
            } catch (CompletionException e) {
                throw unwrap(e);
            }
        }
        return extractions;
    }

    private double[] fitAndScore(ModelType model, List<FeatureVector> batch) {
        Span span = tracer.nextSpan()
                .name("detection.fit_score")
                .tag("model", model.getId())
                .tag("batch.size", String.valueOf(batch.size()))
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return fitAndScore(detectorFactory.create(model), batch);
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            span.error(e);
            throw new ModelFailureException(model.getId(), e);
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static <S> double[] fitAndScore(DetectorModel<S> detector, List<FeatureVector> batch) {
        S trained = detector.fit(batch);
        return detector.score(trained, batch);
    }

    /**
     * Writes every result and waits for all of them. Returns the results that were stored.
     *
     * @throws StoreUnavailableException if any write found the store unreachable
     */
    private List<AnomalyResult> writeAll(String runId, List<AnomalyResult> results) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(results.size());
        for (AnomalyResult result : results) {
            futures.add(CompletableFuture.runAsync(() -> resultRepository.upsert(result), workerPool));
        }

        List<AnomalyResult> persisted = new ArrayList<>(results.size());
        StoreUnavailableException unavailable = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
                persisted.add(results.get(i));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while writing results of run " + runId, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof StoreUnavailableException) {
                    if (unavailable == null) unavailable = (StoreUnavailableException) cause;
                } else if (cause instanceof StoreWriteException) {
                    metricsConfig.recordWriteFailure();
                    log.warn("Run {} could not store result for meter {}: {}",
                            runId, results.get(i).getMeterId(), cause.getMessage());
                } else {
                    metricsConfig.recordWriteFailure();
                    log.error("Run {} failed writing result for meter {}",
                            runId, results.get(i).getMeterId(), cause);
                }
            }
        }
        if (unavailable != null) {
            throw unavailable;
        }
        return persisted;
    }

    private DetectionRun summarize(String runId, ModelType model, double threshold, List<String> requested,
                                   Instant startedAt, List<AnomalyResult> persisted, int skipped,
                                   int failedWrites) {
        int suspicious = 0, critical = 0, high = 0, medium = 0, low = 0;
        for (AnomalyResult result : persisted) {
            if (result.isSuspicious()) suspicious++;
            switch (result.getRiskLevel()) {
                case CRITICAL: critical++; break;
                case HIGH: high++; break;
                case MEDIUM: medium++; break;
                default: low++;
            }
        }
        return DetectionRun.builder()
                .runId(runId)
                .model(model)
                .threshold(threshold)
                .requestedMeterIds(requested)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .metersAnalyzed(persisted.size())
                .metersSkipped(skipped)
                .failedWrites(failedWrites)
                .suspiciousCount(suspicious)
                .criticalCount(critical)
                .highCount(high)
                .mediumCount(medium)
                .lowCount(low)
                .build();
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) return (RuntimeException) cause;
        return e;
    }
}
