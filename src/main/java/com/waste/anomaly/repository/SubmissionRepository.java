package com.waste.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.waste.anomaly.config.AerospikeConfig;
import com.waste.anomaly.model.PagedResponse;
import com.waste.anomaly.model.Submission;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Primary record store for submissions. A stored submission is never overwritten: writing an
 * existing submissionId fails with {@code ResultCode.KEY_EXISTS_ERROR}.
 */
@Repository
public class SubmissionRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;

    public SubmissionRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultReadPolicy") Policy readPolicy,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = new WritePolicy(writePolicy);
        this.writePolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
    }

    public void save(Submission submission) {
        Key key = new Key(namespace, AerospikeConfig.SET_SUBMISSIONS, submission.getSubmissionId());
        client.put(writePolicy, key,
                new Bin("submissionId", submission.getSubmissionId()),
                new Bin("subjectId", submission.getSubjectId()),
                new Bin("quantity", submission.getQuantity().doubleValue()),
                new Bin("createdAt", submission.getCreatedAt()));
    }

    public Submission findById(String submissionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SUBMISSIONS, submissionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * All submissions of a subject created at or after {@code cutoffMillis}, newest first.
     */
    public List<Submission> findBySubjectSince(String subjectId, long cutoffMillis) {
        List<Submission> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUBMISSIONS,
                (key, record) -> {
                    if (!subjectId.equals(record.getString("subjectId"))) return;
                    if (record.getLong("createdAt") < cutoffMillis) return;
                    synchronized (results) {
                        results.add(mapRecord(record));
                    }
                });

        results.sort(Comparator.comparingLong(Submission::getCreatedAt).reversed());
        return results;
    }

    public PagedResponse<Submission> findBySubjectId(String subjectId, int limit, Long before) {
        List<Submission> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUBMISSIONS,
                (key, record) -> {
                    if (!subjectId.equals(record.getString("subjectId"))) return;
                    if (before != null && record.getLong("createdAt") >= before) return;
                    synchronized (results) {
                        results.add(mapRecord(record));
                    }
                });

        results.sort(Comparator.comparingLong(Submission::getCreatedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<Submission> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getCreatedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private Submission mapRecord(Record record) {
        return Submission.builder()
                .submissionId(record.getString("submissionId"))
                .subjectId(record.getString("subjectId"))
                .quantity(record.getDouble("quantity"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
