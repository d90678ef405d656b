package com.bank.patterns.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_LEDGER_TRANSACTIONS = "ledger_transactions";
    public static final String SET_BANK_ACCOUNTS = "bank_accounts";
    public static final String SET_DEBIT_PATTERNS = "debit_patterns";
    public static final String SET_CREDIT_PATTERNS = "credit_patterns";
    public static final String SET_REFERENCE_PATTERNS = "reference_patterns";
    public static final String SET_MINING_METADATA = "mining_metadata";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:banking}")
    private String namespace;

    @Value("${aerospike.read-timeout-ms:3000}")
    private int readTimeoutMs;

    @Value("${aerospike.write-timeout-ms:3000}")
    private int writeTimeoutMs;

    @Value("${aerospike.scan-timeout-ms:30000}")
    private int scanTimeoutMs;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;
        // Start without the cluster; the durable tier then reports failures and the cache degrades.
        clientPolicy.failIfNotConnected = false;

        clientPolicy.readPolicyDefault.totalTimeout = readTimeoutMs;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = writeTimeoutMs;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = writeTimeoutMs;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = readTimeoutMs;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public BatchPolicy defaultBatchPolicy() {
        BatchPolicy policy = new BatchPolicy();
        policy.totalTimeout = readTimeoutMs;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public ScanPolicy defaultScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.concurrentNodes = true;
        policy.includeBinData = true;
        policy.totalTimeout = scanTimeoutMs;
        policy.socketTimeout = 5000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
