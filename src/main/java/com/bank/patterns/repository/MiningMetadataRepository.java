package com.bank.patterns.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.patterns.config.AerospikeConfig;
import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.PatternFamily;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One record per tenant: the latest {@link MiningMetadata} plus the pattern keys of each
 * family, which is how the durable tier finds its rows again.
 */
@Repository
public class MiningMetadataRepository {

    private static final Map<PatternFamily, String> KEY_BINS = Map.of(
            PatternFamily.DEBIT, "debitKeys",
            PatternFamily.CREDIT, "creditKeys",
            PatternFamily.REFERENCE, "refKeys");

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public MiningMetadataRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public StoredMiningMetadata find(String tenantId) {
        Record record = client.get(readPolicy, key(tenantId));
        if (record == null) {
            return null;
        }

        MiningMetadata metadata = MiningMetadata.builder()
                .tenantId(tenantId)
                .lastMined(record.getLong("lastMined"))
                .transactionCount(record.getLong("txnCount"))
                .cumulativeTransactionCount(record.getLong("cumulTxnCount"))
                .rangeFrom(toDate(record, "rangeFrom"))
                .rangeTo(toDate(record, "rangeTo"))
                .coveredFrom(toDate(record, "coveredFrom"))
                .patternCount(record.getInt("patternCount"))
                .discardedCount(record.getLong("discarded"))
                .build();

        Map<PatternFamily, List<String>> keys = new EnumMap<>(PatternFamily.class);
        for (Map.Entry<PatternFamily, String> bin : KEY_BINS.entrySet()) {
            List<String> familyKeys = new ArrayList<>();
            List<?> stored = record.getList(bin.getValue());
            if (stored != null) {
                for (Object key : stored) {
                    familyKeys.add(key.toString());
                }
            }
            keys.put(bin.getKey(), familyKeys);
        }
        return new StoredMiningMetadata(metadata, keys);
    }

    public void save(MiningMetadata metadata, Map<PatternFamily, List<String>> patternKeys) {
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("tenantId", metadata.getTenantId()),
                new Bin("lastMined", metadata.getLastMined()),
                new Bin("txnCount", metadata.getTransactionCount()),
                new Bin("cumulTxnCount", metadata.getCumulativeTransactionCount()),
                new Bin("patternCount", metadata.getPatternCount()),
                new Bin("discarded", metadata.getDiscardedCount())));

        addDate(bins, "rangeFrom", metadata.getRangeFrom());
        addDate(bins, "rangeTo", metadata.getRangeTo());
        addDate(bins, "coveredFrom", metadata.getCoveredFrom());

        for (Map.Entry<PatternFamily, String> bin : KEY_BINS.entrySet()) {
            List<String> keys = patternKeys.getOrDefault(bin.getKey(), List.of());
            bins.add(new Bin(bin.getValue(), new ArrayList<>(keys)));
        }

        client.put(writePolicy, key(metadata.getTenantId()), bins.toArray(new Bin[0]));
    }

    public boolean delete(String tenantId) {
        return client.delete(writePolicy, key(tenantId));
    }

    public boolean exists(String tenantId) {
        return client.exists(readPolicy, key(tenantId));
    }

    private Key key(String tenantId) {
        return new Key(namespace, AerospikeConfig.SET_MINING_METADATA, tenantId);
    }

    private static void addDate(List<Bin> bins, String name, LocalDate date) {
        if (date != null) {
            bins.add(new Bin(name, date.toEpochDay()));
        }
    }

    private static LocalDate toDate(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number day ? LocalDate.ofEpochDay(day.longValue()) : null;
    }
}
