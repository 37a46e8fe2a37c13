package com.waste.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.waste.anomaly.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Blob-style store for serialized anomaly reports, keyed by {@code subjectId:createdAt:recordId}.
 */
@Repository
public class ReportArchiveRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ReportArchiveRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(String reportKey, String reportJson, long archivedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_REPORTS, reportKey);
        client.put(writePolicy, key,
                new Bin("reportKey", reportKey),
                new Bin("report", reportJson),
                new Bin("archivedAt", archivedAt));
    }

    public String findReport(String reportKey) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_REPORTS, reportKey);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return record.getString("report");
    }
}
