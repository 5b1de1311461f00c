package com.powerguard.anomaly.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.powerguard.anomaly.config.DetectionConfig;
import com.powerguard.anomaly.config.MetricsConfig;
import com.powerguard.anomaly.engine.detector.DetectorFactory;
import com.powerguard.anomaly.engine.features.FeatureExtractor;
import com.powerguard.anomaly.engine.features.NominalProfile;
import com.powerguard.anomaly.engine.scoring.ExplanationGenerator;
import com.powerguard.anomaly.engine.scoring.RiskClassifier;
import com.powerguard.anomaly.engine.scoring.ScoreNormalizer;
import com.powerguard.anomaly.exception.EmptyBatchException;
import com.powerguard.anomaly.exception.InvalidThresholdException;
import com.powerguard.anomaly.exception.StoreUnavailableException;
import com.powerguard.anomaly.exception.StoreWriteException;
import com.powerguard.anomaly.exception.UnknownModelException;
import com.powerguard.anomaly.model.AnomalyResult;
import com.powerguard.anomaly.model.DetectionRequest;
import com.powerguard.anomaly.model.DetectionRun;
import com.powerguard.anomaly.model.ModelType;
import com.powerguard.anomaly.model.Reading;
import com.powerguard.anomaly.model.RiskLevel;
import com.powerguard.anomaly.repository.AnomalyResultRepository;
import com.powerguard.anomaly.repository.DetectionRunRepository;
import com.powerguard.anomaly.repository.ReadingRepository;
import com.powerguard.anomaly.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DetectionServiceTest {

    @Mock private ReadingRepository readingRepository;
    @Mock private AnomalyResultRepository resultRepository;
    @Mock private DetectionRunRepository runRepository;
    @Mock private MetricsConfig metricsConfig;

    private ExecutorService workerPool;
    private DetectionService detectionService;
    private Map<String, AnomalyResult> store;

    @BeforeEach
    void setUp() {
        DetectionConfig config = TestDataFactory.detectionConfig();
        FeatureExtractor extractor = new FeatureExtractor(config);
        NominalProfile nominalProfile = new NominalProfile(extractor);
        workerPool = Executors.newFixedThreadPool(2);
        store = new ConcurrentHashMap<>();

        detectionService = new DetectionService(
                readingRepository, resultRepository, runRepository,
                extractor, nominalProfile, new DetectorFactory(config, nominalProfile),
                new ScoreNormalizer(), new RiskClassifier(), new ExplanationGenerator(config),
                config, metricsConfig, Tracer.NOOP, workerPool);
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdownNow();
    }

    @Test
    void flatVersusNightSpikeMeter_spikeMeterRankedCriticalWithNightExplanation() {
        givenReadings(List.of("A", "B"), Map.of(
                "A", TestDataFactory.flatMeter("A", 1.0, 30),
                "B", TestDataFactory.nightSpikeMeter("B", 30)));
        storeWrites();

        DetectionRun run = detectionService.runDetection(request("isolation_forest", null, List.of("A", "B")));

        assertThat(run.getMetersAnalyzed()).isEqualTo(2);
        assertThat(run.getMetersSkipped()).isZero();
        assertThat(run.getSuspiciousCount()).isEqualTo(1);

        AnomalyResult a = store.get("A");
        AnomalyResult b = store.get("B");
        assertThat(b.getAnomalyScore()).isGreaterThan(a.getAnomalyScore());
        assertThat(b.getRiskLevel()).isIn(RiskLevel.HIGH, RiskLevel.CRITICAL);
        assertThat(a.getRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(b.isSuspicious()).isTrue();
        assertThat(a.isSuspicious()).isFalse();
        assertThat(b.getExplanation()).contains("night");
        assertThat(a.getExplanation()).contains("within normal bounds");
        assertThat(b.getModelUsed()).isEqualTo(ModelType.ISOLATION_FOREST);
        assertThat(b.getRunId()).isEqualTo(run.getRunId());

        verify(runRepository).save(run);
        verify(metricsConfig).recordRun(run);
    }

    @Test
    void secondRun_replacesFirstRunsResults() {
        givenReadings(List.of("A", "B"), Map.of(
                "A", TestDataFactory.flatMeter("A", 1.0, 30),
                "B", TestDataFactory.nightSpikeMeter("B", 30)));
        storeWrites();

        DetectionRun first = detectionService.runDetection(request("isolation_forest", 0.0, List.of("A", "B")));
        assertThat(store.get("A").isSuspicious()).isTrue();

        DetectionRun second = detectionService.runDetection(request("isolation_forest", 0.5, List.of("A", "B")));

        assertThat(store).hasSize(2);
        assertThat(store.get("A").isSuspicious()).isFalse();
        assertThat(store.get("A").getRunId()).isEqualTo(second.getRunId());
        assertThat(second.getRunId()).isNotEqualTo(first.getRunId());
        assertThat(second.getSuspiciousCount()).isEqualTo(1);
    }

    @Test
    void unknownModel_failsBeforeReadingOrWriting() {
        assertThatThrownBy(() -> detectionService.runDetection(request("random_forest", null, null)))
                .isInstanceOf(UnknownModelException.class)
                .hasMessageContaining("random_forest");

        verifyNoInteractions(readingRepository, resultRepository, runRepository);
        verify(metricsConfig).recordRunFailed("UNKNOWN_MODEL");
    }

    @Test
    void thresholdAboveOne_rejected() {
        assertThatThrownBy(() -> detectionService.runDetection(request("isolation_forest", 1.5, null)))
                .isInstanceOf(InvalidThresholdException.class);

        verifyNoInteractions(readingRepository, resultRepository);
    }

    @Test
    void meterWithFiveReadings_skippedAndNotWritten() {
        Map<String, List<Reading>> readings = new TreeMap<>();
        readings.put("A", TestDataFactory.flatMeter("A", 1.0, 30));
        readings.put("B", TestDataFactory.nightSpikeMeter("B", 30));
        readings.put("C", TestDataFactory.hourlyReadings("C", 5));
        when(readingRepository.findAllGroupedByMeter()).thenReturn(readings);
        storeWrites();
        Logger serviceLogger = (Logger) LoggerFactory.getLogger(DetectionService.class);
        ListAppender<ILoggingEvent> logged = new ListAppender<>();
        logged.start();
        serviceLogger.addAppender(logged);

        DetectionRun run;
        try {
            run = detectionService.runDetection(request("isolation_forest", null, null));
        } finally {
            serviceLogger.detachAppender(logged);
        }

        assertThat(run.getMetersAnalyzed()).isEqualTo(2);
        assertThat(run.getMetersSkipped()).isEqualTo(1);
        assertThat(run.getRequestedMeterIds()).isNull();
        assertThat(store).containsOnlyKeys("A", "B");
        verify(metricsConfig).recordMeterSkipped();
        assertThat(logged.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .anySatisfy(e -> assertThat(e.getFormattedMessage()).contains("skipped meter C"));
    }

    @Test
    void noMeterWithEnoughReadings_failsWithEmptyBatch() {
        givenReadings(List.of("C", "UNKNOWN"), Map.of(
                "C", TestDataFactory.hourlyReadings("C", 5),
                "UNKNOWN", List.of()));

        assertThatThrownBy(() -> detectionService.runDetection(request("isolation_forest", null, List.of("C", "UNKNOWN"))))
                .isInstanceOf(EmptyBatchException.class);

        verifyNoInteractions(resultRepository);
        verify(runRepository, never()).save(any());
        verify(metricsConfig).recordRunFailed("EMPTY_BATCH");
    }

    @Test
    void singleFailedWrite_countedAndRunCompletes() {
        givenReadings(List.of("A", "B"), Map.of(
                "A", TestDataFactory.flatMeter("A", 1.0, 30),
                "B", TestDataFactory.nightSpikeMeter("B", 30)));
        doAnswer(inv -> {
            AnomalyResult result = inv.getArgument(0);
            if ("A".equals(result.getMeterId())) {
                throw new StoreWriteException("A", new RuntimeException("record too big"));
            }
            store.put(result.getMeterId(), result);
            return null;
        }).when(resultRepository).upsert(any(AnomalyResult.class));

        DetectionRun run = detectionService.runDetection(request("isolation_forest", null, List.of("A", "B")));

        assertThat(run.getMetersAnalyzed()).isEqualTo(1);
        assertThat(run.getFailedWrites()).isEqualTo(1);
        assertThat(run.getCriticalCount() + run.getHighCount() + run.getMediumCount() + run.getLowCount())
                .isEqualTo(1);
        assertThat(store).containsOnlyKeys("B");
        verify(metricsConfig).recordWriteFailure();
    }

    @Test
    void unreachableStore_failsRunWithoutSummary() {
        givenReadings(List.of("A", "B"), Map.of(
                "A", TestDataFactory.flatMeter("A", 1.0, 30),
                "B", TestDataFactory.nightSpikeMeter("B", 30)));
        doThrow(new StoreUnavailableException("connection refused", new RuntimeException()))
                .when(resultRepository).upsert(any(AnomalyResult.class));

        assertThatThrownBy(() -> detectionService.runDetection(request("isolation_forest", null, List.of("A", "B"))))
                .isInstanceOf(StoreUnavailableException.class);

        verify(runRepository, never()).save(any());
        verify(metricsConfig).recordRunFailed("STORE_UNAVAILABLE");
    }

    @Test
    void autoencoderRun_ranksNightSpikeMeterAboveFlatMeters() {
        givenReadings(List.of("A", "B", "C"), Map.of(
                "A", TestDataFactory.flatMeter("A", 1.0, 30),
                "B", TestDataFactory.nightSpikeMeter("B", 30),
                "C", TestDataFactory.flatMeter("C", 1.3, 30)));
        storeWrites();

        DetectionRun run = detectionService.runDetection(request("autoencoder", 0.5, List.of("A", "B", "C")));

        assertThat(run.getModel()).isEqualTo(ModelType.AUTOENCODER);
        assertThat(run.getMetersAnalyzed()).isEqualTo(3);
        assertThat(run.getCriticalCount() + run.getHighCount() + run.getMediumCount() + run.getLowCount())
                .isEqualTo(3);
        assertThat(store.values()).allSatisfy(r -> {
            assertThat(r.getAnomalyScore()).isBetween(0.0, 1.0);
            assertThat(r.getModelUsed()).isEqualTo(ModelType.AUTOENCODER);
        });
        assertThat(store.values()).anySatisfy(r -> assertThat(r.getAnomalyScore()).isEqualTo(1.0));

        AnomalyResult b = store.get("B");
        assertThat(b.getAnomalyScore())
                .isGreaterThan(store.get("A").getAnomalyScore())
                .isGreaterThan(store.get("C").getAnomalyScore());
        assertThat(b.getRiskLevel()).isIn(RiskLevel.HIGH, RiskLevel.CRITICAL);
        assertThat(b.isSuspicious()).isTrue();
    }

    @Test
    void duplicateRequestedIds_analyzedOnce() {
        givenReadings(List.of("A", "B"), Map.of(
                "A", TestDataFactory.flatMeter("A", 1.0, 30),
                "B", TestDataFactory.nightSpikeMeter("B", 30)));
        storeWrites();

        DetectionRun run = detectionService.runDetection(request("isolation_forest", null, List.of("A", "B", "A")));

        assertThat(run.getMetersAnalyzed()).isEqualTo(2);
        assertThat(run.getRequestedMeterIds()).containsExactly("A", "B");
    }

    private void givenReadings(List<String> ids, Map<String, List<Reading>> readings) {
        when(readingRepository.findByMeterIds(ids)).thenReturn(new TreeMap<>(readings));
    }

    private void storeWrites() {
        doAnswer(inv -> {
            AnomalyResult result = inv.getArgument(0);
            store.put(result.getMeterId(), result);
            return null;
        }).when(resultRepository).upsert(any(AnomalyResult.class));
    }

    private static DetectionRequest request(String model, Double threshold, List<String> meterIds) {
        return DetectionRequest.builder()
                .model(model)
                .threshold(threshold)
                .meterIds(meterIds)
                .build();
    }
}
