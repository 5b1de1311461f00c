package com.powerguard.anomaly.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.powerguard.anomaly.config.AerospikeConfig;
import com.powerguard.anomaly.model.DetectionRun;
import com.powerguard.anomaly.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class DetectionRunRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunRepository.class);

    private final IAerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public DetectionRunRepository(IAerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(DetectionRun run) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, run.getRunId());

        Bin runIdBin = new Bin("runId", run.getRunId());
        Bin modelBin = new Bin("model", run.getModel().getId());
        Bin thresholdBin = new Bin("threshold", run.getThreshold());
        Bin requestedBin = run.getRequestedMeterIds() == null
                ? Bin.asNull("requestedIds")
                : new Bin("requestedIds", run.getRequestedMeterIds());
        Bin startedAtBin = new Bin("startedAt", run.getStartedAt().toEpochMilli());
        Bin completedAtBin = new Bin("completedAt", run.getCompletedAt().toEpochMilli());
        Bin analyzedBin = new Bin("analyzed", run.getMetersAnalyzed());
        Bin skippedBin = new Bin("skipped", run.getMetersSkipped());
        Bin failedBin = new Bin("failedWrites", run.getFailedWrites());
        Bin suspiciousBin = new Bin("suspicious", run.getSuspiciousCount());
        Bin criticalBin = new Bin("critical", run.getCriticalCount());
        Bin highBin = new Bin("high", run.getHighCount());
        Bin mediumBin = new Bin("medium", run.getMediumCount());
        Bin lowBin = new Bin("low", run.getLowCount());

        try {
            client.put(writePolicy, key,
                    runIdBin, modelBin, thresholdBin, requestedBin, startedAtBin, completedAtBin,
                    analyzedBin, skippedBin, failedBin, suspiciousBin,
                    criticalBin, highBin, mediumBin, lowBin);
        } catch (AerospikeException e) {
            throw AerospikeFailures.onWrite(e, run.getRunId());
        }
    }

    public Optional<DetectionRun> findById(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runId);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw AerospikeFailures.onRead(e, "run " + runId);
        }
        return Optional.ofNullable(record).map(this::mapRecord);
    }

    /**
     * Most recently completed run.
     */
    public Optional<DetectionRun> findLatest() {
        List<DetectionRun> runs = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTION_RUNS,
                    (key, record) -> {
                        try {
                            DetectionRun run = mapRecord(record);
                            synchronized (runs) {
                                runs.add(run);
                            }
                        } catch (RuntimeException e) {
                            log.warn("Failed to deserialize detection run record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw AerospikeFailures.onRead(e, "detection runs");
        }
        return runs.stream().max(Comparator.comparing(DetectionRun::getCompletedAt));
    }

    public void deleteAll() {
        try {
            client.truncate(null, namespace, AerospikeConfig.SET_DETECTION_RUNS, null);
        } catch (AerospikeException e) {
            throw AerospikeFailures.onWrite(e, "detection runs");
        }
    }

    @SuppressWarnings("unchecked")
    private DetectionRun mapRecord(Record record) {
        List<?> requested = record.getList("requestedIds");
        return DetectionRun.builder()
                .runId(record.getString("runId"))
                .model(ModelType.fromId(record.getString("model")))
                .threshold(record.getDouble("threshold"))
                .requestedMeterIds(requested == null ? null : new ArrayList<>((List<String>) requested))
                .startedAt(Instant.ofEpochMilli(record.getLong("startedAt")))
                .completedAt(Instant.ofEpochMilli(record.getLong("completedAt")))
                .metersAnalyzed(record.getInt("analyzed"))
                .metersSkipped(record.getInt("skipped"))
                .failedWrites(record.getInt("failedWrites"))
                .suspiciousCount(record.getInt("suspicious"))
                .criticalCount(record.getInt("critical"))
                .highCount(record.getInt("high"))
                .mediumCount(record.getInt("medium"))
                .lowCount(record.getInt("low"))
                .build();
    }
}
