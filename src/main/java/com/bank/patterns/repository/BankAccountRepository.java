package com.bank.patterns.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.bank.patterns.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-tenant bank and cash account identifiers, one record per tenant holding an
 * {@code accounts} list bin.
 */
@Repository
public class BankAccountRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;

    public BankAccountRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
    }

    /** Returns an empty set for a tenant without reference data. */
    public Set<String> findBankAccounts(String tenantId) {
        Key key = new Key(namespace, AerospikeConfig.SET_BANK_ACCOUNTS, tenantId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Set.of();

        List<?> accounts = record.getList("accounts");
        if (accounts == null) return Set.of();

        Set<String> result = new HashSet<>();
        for (Object account : accounts) {
            if (account != null) {
                result.add(account.toString().trim());
            }
        }
        return result;
    }
}
