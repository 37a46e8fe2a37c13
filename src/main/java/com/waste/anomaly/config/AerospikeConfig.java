package com.waste.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Aerospike connection and the three sets the service owns. Tests replace these beans with mocks.
 */
@Configuration
@Profile("!test")
public class AerospikeConfig {

    private static final Logger log = LoggerFactory.getLogger(AerospikeConfig.class);

    /** Submissions, keyed by submissionId. */
    public static final String SET_SUBMISSIONS = "waste_submissions";
    /** Flagged anomaly records, keyed by recordId. Oversight-only. */
    public static final String SET_ANOMALY_RECORDS = "anomaly_records";
    /** Archived JSON reports, keyed by subjectId:createdAt:recordId. */
    public static final String SET_ANOMALY_REPORTS = "anomaly_reports";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:waste}")
    private String namespace;

    @Value("${aerospike.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = connectTimeoutMs;
        applyTimeouts(clientPolicy.readPolicyDefault);
        applyTimeouts(clientPolicy.writePolicyDefault);

        log.info("Connecting to Aerospike at {}:{}, namespace={}", host, port, namespace);
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        // Keep the user key on the record so scans can report it
        policy.sendKey = true;
        applyTimeouts(policy);
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        applyTimeouts(policy);
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    private void applyTimeouts(Policy policy) {
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
    }
}
