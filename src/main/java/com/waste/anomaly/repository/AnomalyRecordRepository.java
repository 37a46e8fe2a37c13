package com.waste.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.waste.anomaly.config.AerospikeConfig;
import com.waste.anomaly.model.AnomalyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class AnomalyRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AnomalyRecordRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(AnomalyRecord anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RECORDS, anomaly.getRecordId());

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("recordId", anomaly.getRecordId()),
                new Bin("subjectId", anomaly.getSubjectId()),
                new Bin("submissionId", anomaly.getSubmissionId()),
                new Bin("quantity", anomaly.getQuantity()),
                new Bin("mean", anomaly.getMean()),
                new Bin("stdDev", anomaly.getStdDev()),
                new Bin("zScore", anomaly.getZScore()),
                new Bin("flagged", anomaly.isFlagged()),
                new Bin("createdAt", anomaly.getCreatedAt())));
        if (anomaly.getReportKey() != null) {
            bins.add(new Bin("reportKey", anomaly.getReportKey()));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public AnomalyRecord findByRecordId(String recordId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RECORDS, recordId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Attach the archive pointer. The only change ever made to a stored record.
     */
    public void updateReportKey(String recordId, String reportKey) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RECORDS, recordId);
        client.put(writePolicy, key, new Bin("reportKey", reportKey));
    }

    /**
     * Flagged records with {@code fromMillis <= createdAt < toMillis}, newest first.
     * The window is applied while scanning so callers only ever see bounded results.
     */
    public List<AnomalyRecord> findCreatedBetween(long fromMillis, long toMillis) {
        List<AnomalyRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RECORDS,
                (key, record) -> {
                    try {
                        if (!record.getBoolean("flagged")) return;
                        long createdAt = record.getLong("createdAt");
                        if (createdAt < fromMillis || createdAt >= toMillis) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AnomalyRecord::getCreatedAt).reversed());
        return results;
    }

    public long countCreatedBetween(long fromMillis, long toMillis) {
        AtomicLong count = new AtomicLong();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RECORDS,
                (key, record) -> {
                    try {
                        if (!record.getBoolean("flagged")) return;
                        long createdAt = record.getLong("createdAt");
                        if (createdAt >= fromMillis && createdAt < toMillis) {
                            count.incrementAndGet();
                        }
                    } catch (Exception e) {
                        log.warn("Failed to count anomaly record: {}", e.getMessage());
                    }
                });
        return count.get();
    }

    /**
     * The {@code limit} most recent flagged records, newest first.
     */
    public List<AnomalyRecord> findRecent(int limit) {
        List<AnomalyRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RECORDS,
                (key, record) -> {
                    try {
                        if (!record.getBoolean("flagged")) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AnomalyRecord::getCreatedAt).reversed()
                .thenComparing(AnomalyRecord::getRecordId, Comparator.nullsLast(Comparator.naturalOrder())));
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private AnomalyRecord mapRecord(Record record) {
        return AnomalyRecord.builder()
                .recordId(record.getString("recordId"))
                .subjectId(record.getString("subjectId"))
                .submissionId(record.getString("submissionId"))
                .quantity(record.getDouble("quantity"))
                .mean(record.getDouble("mean"))
                .stdDev(record.getDouble("stdDev"))
                .zScore(record.getDouble("zScore"))
                .flagged(record.getBoolean("flagged"))
                .createdAt(record.getLong("createdAt"))
                .reportKey(record.getString("reportKey"))
                .build();
    }
}
