package com.powerguard.anomaly.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powerguard.anomaly.config.AerospikeConfig;
import com.powerguard.anomaly.engine.features.FeatureVector;
import com.powerguard.anomaly.model.AnomalyResult;
import com.powerguard.anomaly.model.ModelType;
import com.powerguard.anomaly.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Current anomaly result per meter, keyed by meter id.
 * Every write replaces the whole record, so readers see either the previous result or the new one.
 */
@Repository
public class AnomalyResultRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyResultRepository.class);

    private final IAerospikeClient client;
    private final String namespace;
    private final WritePolicy replacePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnomalyResultRepository(IAerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.replacePolicy = new WritePolicy(writePolicy);
        this.replacePolicy.recordExistsAction = RecordExistsAction.REPLACE;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @throws com.powerguard.anomaly.exception.StoreUnavailableException if the store cannot be reached
     * @throws com.powerguard.anomaly.exception.StoreWriteException if this record could not be written
     */
    public void upsert(AnomalyResult result) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RESULTS, result.getMeterId());

        Bin meterIdBin = new Bin("meterId", result.getMeterId());
        Bin scoreBin = new Bin("score", result.getAnomalyScore());
        Bin riskLevelBin = new Bin("riskLevel", result.getRiskLevel().name());
        Bin suspiciousBin = new Bin("suspicious", result.isSuspicious());
        Bin explanationBin = new Bin("explanation", result.getExplanation());
        Bin modelBin = new Bin("model", result.getModelUsed().getId());
        Bin runIdBin = new Bin("runId", result.getRunId());
        Bin featuresBin = new Bin("features", serializeFeatures(result.getFeatures()));
        Bin computedAtBin = new Bin("computedAt", result.getComputedAt().toEpochMilli());

        try {
            client.put(replacePolicy, key,
                    meterIdBin, scoreBin, riskLevelBin, suspiciousBin, explanationBin,
                    modelBin, runIdBin, featuresBin, computedAtBin);
        } catch (AerospikeException e) {
            throw AerospikeFailures.onWrite(e, result.getMeterId());
        }
    }

    public Optional<AnomalyResult> findByMeterId(String meterId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RESULTS, meterId);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw AerospikeFailures.onRead(e, "result of " + meterId);
        }
        return Optional.ofNullable(record).map(this::mapRecord);
    }

    /**
     * All current results, highest score first, ties by meter id.
     */
    public List<AnomalyResult> findAll() {
        List<AnomalyResult> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RESULTS,
                    (key, record) -> {
                        try {
                            AnomalyResult result = mapRecord(record);
                            synchronized (results) {
                                results.add(result);
                            }
                        } catch (RuntimeException e) {
                            log.warn("Failed to deserialize anomaly result record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw AerospikeFailures.onRead(e, "anomaly results");
        }
        results.sort(Comparator.comparingDouble(AnomalyResult::getAnomalyScore).reversed()
                .thenComparing(AnomalyResult::getMeterId));
        return results;
    }

    public void deleteAll() {
        try {
            client.truncate(null, namespace, AerospikeConfig.SET_ANOMALY_RESULTS, null);
        } catch (AerospikeException e) {
            throw AerospikeFailures.onWrite(e, "anomaly results");
        }
    }

    private AnomalyResult mapRecord(Record record) {
        return AnomalyResult.builder()
                .meterId(record.getString("meterId"))
                .anomalyScore(record.getDouble("score"))
                .riskLevel(RiskLevel.valueOf(record.getString("riskLevel")))
                .suspicious(record.getBoolean("suspicious"))
                .explanation(record.getString("explanation"))
                .modelUsed(ModelType.fromId(record.getString("model")))
                .runId(record.getString("runId"))
                .features(deserializeFeatures(record.getString("features")))
                .computedAt(Instant.ofEpochMilli(record.getLong("computedAt")))
                .build();
    }

    private String serializeFeatures(FeatureVector features) {
        if (features == null) return null;
        try {
            return objectMapper.writeValueAsString(features);
        } catch (Exception e) {
            log.error("Failed to serialize feature vector", e);
            return null;
        }
    }

    private FeatureVector deserializeFeatures(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, FeatureVector.class);
        } catch (Exception e) {
            log.error("Failed to deserialize feature vector", e);
            return null;
        }
    }
}
