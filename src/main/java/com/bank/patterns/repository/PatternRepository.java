package com.bank.patterns.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.patterns.config.AerospikeConfig;
import com.bank.patterns.model.Pattern;
import com.bank.patterns.model.PatternFamily;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One set per pattern family, one record per {@code (tenant, patternKey)}.
 * Saves are full-record upserts, so repeating a save leaves the same stored state.
 */
@Repository
public class PatternRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final BatchPolicy batchPolicy;

    public PatternRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.batchPolicy = batchPolicy;
    }

    public static String setFor(PatternFamily family) {
        return switch (family) {
            case DEBIT -> AerospikeConfig.SET_DEBIT_PATTERNS;
            case CREDIT -> AerospikeConfig.SET_CREDIT_PATTERNS;
            case REFERENCE -> AerospikeConfig.SET_REFERENCE_PATTERNS;
        };
    }

    /**
     * Batch-reads the given keys. Keys without a stored record are absent from the result.
     */
    public Map<String, Pattern> findAll(String tenantId, PatternFamily family, List<String> patternKeys) {
        Map<String, Pattern> found = new HashMap<>();
        if (patternKeys.isEmpty()) return found;

        Key[] keys = new Key[patternKeys.size()];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = key(tenantId, family, patternKeys.get(i));
        }
        Record[] records = client.get(batchPolicy, keys);
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                found.put(patternKeys.get(i), mapRecord(family, patternKeys.get(i), records[i]));
            }
        }
        return found;
    }

    public void save(String tenantId, Pattern pattern) {
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("tenantId", tenantId),
                new Bin("family", pattern.getFamily().name()),
                new Bin("patternKey", pattern.getPatternKey()),
                new Bin("keywords", pattern.getKeywords()),
                new Bin("predicted", pattern.getPredictedValue()),
                new Bin("occurrences", pattern.getOccurrences()),
                new Bin("avgAmount", pattern.getAverageAmount()),
                new Bin("confidence", pattern.getConfidence())));

        if (pattern.getKnownAccount() != null) {
            bins.add(new Bin("knownAcct", pattern.getKnownAccount()));
        }
        if (pattern.getLastSeen() != null) {
            bins.add(new Bin("lastSeen", pattern.getLastSeen().toEpochDay()));
        }

        client.put(writePolicy, key(tenantId, pattern.getFamily(), pattern.getPatternKey()),
                bins.toArray(new Bin[0]));
    }

    public void delete(String tenantId, PatternFamily family, String patternKey) {
        client.delete(writePolicy, key(tenantId, family, patternKey));
    }

    private Key key(String tenantId, PatternFamily family, String patternKey) {
        return new Key(namespace, setFor(family), tenantId + ":" + patternKey);
    }

    private Pattern mapRecord(PatternFamily family, String patternKey, Record record) {
        List<String> keywords = new ArrayList<>();
        List<?> stored = record.getList("keywords");
        if (stored != null) {
            for (Object keyword : stored) {
                keywords.add(keyword.toString());
            }
        }
        Object lastSeen = record.getValue("lastSeen");

        return Pattern.builder()
                .family(family)
                .patternKey(patternKey)
                .knownAccount(record.getString("knownAcct"))
                .keywords(keywords)
                .predictedValue(record.getString("predicted"))
                .occurrences(record.getLong("occurrences"))
                .averageAmount(record.getDouble("avgAmount"))
                .lastSeen(lastSeen instanceof Number day ? LocalDate.ofEpochDay(day.longValue()) : null)
                .confidence(record.getDouble("confidence"))
                .build();
    }
}
