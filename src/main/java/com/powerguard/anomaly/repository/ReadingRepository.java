package com.powerguard.anomaly.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.powerguard.anomaly.config.AerospikeConfig;
import com.powerguard.anomaly.model.MeterSummary;
import com.powerguard.anomaly.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Meter readings, one record per (meter, timestamp). Re-ingesting the same timestamp replaces the value.
 * Timestamps are naive local date-times, stored as epoch seconds read at UTC so they round-trip unchanged.
 */
@Repository
public class ReadingRepository {

    private static final Logger log = LoggerFactory.getLogger(ReadingRepository.class);

    private final IAerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public ReadingRepository(IAerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    /**
     * Stores readings meter by meter. A meter is registered before its first reading is written,
     * so a failure part-way never leaves stored readings of an unregistered meter.
     */
    public void saveAll(Collection<Reading> readings) {
        Map<String, List<Reading>> byMeter = new LinkedHashMap<>();
        for (Reading reading : readings) {
            byMeter.computeIfAbsent(reading.getMeterId(), k -> new ArrayList<>()).add(reading);
        }
        for (Map.Entry<String, List<Reading>> entry : byMeter.entrySet()) {
            registerMeter(entry.getKey());
            for (Reading reading : entry.getValue()) {
                long ts = reading.getTimestamp().toEpochSecond(ZoneOffset.UTC);
                String recordKey = reading.getMeterId() + "|" + ts;
                Key key = new Key(namespace, AerospikeConfig.SET_READINGS, recordKey);
                try {
                    client.put(writePolicy, key,
                            new Bin("meterId", reading.getMeterId()),
                            new Bin("ts", ts),
                            new Bin("kwh", reading.getConsumptionKwh()));
                } catch (AerospikeException e) {
                    throw AerospikeFailures.onWrite(e, recordKey);
                }
            }
        }
        log.debug("Stored {} readings for {} meters", readings.size(), byMeter.size());
    }

    // Create-only so the first registration time survives later ingests.
    private void registerMeter(String meterId) {
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        Key key = new Key(namespace, AerospikeConfig.SET_METERS, meterId);
        try {
            client.put(createOnly, key,
                    new Bin("meterId", meterId),
                    new Bin("registeredAt", System.currentTimeMillis()));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return;
            }
            throw AerospikeFailures.onWrite(e, meterId);
        }
    }

    /**
     * Readings of one meter in timestamp order. Filtered on the server.
     */
    public List<Reading> findByMeterId(String meterId) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.filterExp = Exp.build(Exp.eq(Exp.stringBin("meterId"), Exp.val(meterId)));
        List<Reading> readings = new ArrayList<>();
        scanReadings(scanPolicy, readings::add);
        readings.sort(Comparator.comparing(Reading::getTimestamp));
        return readings;
    }

    /**
     * Readings for the given meters. Every requested id is present in the result, unknown ids map to an empty list.
     */
    public Map<String, List<Reading>> findByMeterIds(Collection<String> meterIds) {
        Set<String> wanted = new HashSet<>(meterIds);
        Map<String, List<Reading>> grouped = new TreeMap<>();
        for (String meterId : wanted) {
            grouped.put(meterId, new ArrayList<>());
        }
        scanReadings(reading -> {
            List<Reading> list = grouped.get(reading.getMeterId());
            if (list != null) list.add(reading);
        });
        return grouped;
    }

    /**
     * All readings grouped by meter id, in meter id order.
     */
    public Map<String, List<Reading>> findAllGroupedByMeter() {
        Map<String, List<Reading>> grouped = new TreeMap<>();
        scanReadings(reading -> grouped.computeIfAbsent(reading.getMeterId(), k -> new ArrayList<>()).add(reading));
        return grouped;
    }

    /**
     * Registered meters in meter id order.
     */
    public List<MeterSummary> findAllMeters() {
        Map<String, MeterSummary> meters = new TreeMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_METERS,
                    (key, record) -> {
                        String meterId = record.getString("meterId");
                        if (meterId == null) return;
                        Object registeredAt = record.getValue("registeredAt");
                        MeterSummary meter = MeterSummary.builder()
                                .meterId(meterId)
                                .registeredAt(registeredAt == null
                                        ? null : Instant.ofEpochMilli(record.getLong("registeredAt")))
                                .build();
                        synchronized (meters) {
                            meters.put(meterId, meter);
                        }
                    });
        } catch (AerospikeException e) {
            throw AerospikeFailures.onRead(e, "meters");
        }
        return new ArrayList<>(meters.values());
    }

    public List<String> findAllMeterIds() {
        return findAllMeters().stream().map(MeterSummary::getMeterId).toList();
    }

    public long countMeters() {
        return findAllMeterIds().size();
    }

    // Key-only scan.
    public long countReadings() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = false;
        AtomicLong count = new AtomicLong();
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_READINGS,
                    (key, record) -> count.incrementAndGet());
        } catch (AerospikeException e) {
            throw AerospikeFailures.onRead(e, "reading count");
        }
        return count.get();
    }

    public void deleteAll() {
        try {
            client.truncate(null, namespace, AerospikeConfig.SET_READINGS, null);
            client.truncate(null, namespace, AerospikeConfig.SET_METERS, null);
        } catch (AerospikeException e) {
            throw AerospikeFailures.onWrite(e, "readings");
        }
        log.info("Truncated readings and meters sets");
    }

    // Callbacks are serialized on this monitor; scans with concurrentNodes call back from several threads.
    private void scanReadings(Consumer<Reading> consumer) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        scanReadings(scanPolicy, consumer);
    }

    private void scanReadings(ScanPolicy scanPolicy, Consumer<Reading> consumer) {
        Object lock = new Object();
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_READINGS,
                    (key, record) -> {
                        Reading reading = mapRecord(record);
                        if (reading == null) return;
                        synchronized (lock) {
                            consumer.accept(reading);
                        }
                    });
        } catch (AerospikeException e) {
            throw AerospikeFailures.onRead(e, "readings");
        }
    }

    private Reading mapRecord(Record record) {
        String meterId = record.getString("meterId");
        if (meterId == null) {
            log.warn("Skipping reading record without meterId");
            return null;
        }
        return Reading.builder()
                .meterId(meterId)
                .timestamp(LocalDateTime.ofEpochSecond(record.getLong("ts"), 0, ZoneOffset.UTC))
                .consumptionKwh(record.getDouble("kwh"))
                .build();
    }
}
