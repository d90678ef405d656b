package com.bank.patterns.testutil;

import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.Pattern;
import com.bank.patterns.model.PatternFamily;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.Transaction;

import java.time.LocalDate;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final String TENANT = "TENANT-001";
    public static final String BANK_ACCOUNT = "1010";

    private TestDataFactory() {}

    public static Transaction createTransaction(String txnId, LocalDate date, String description,
                                                double amount, String debit, String credit, String reference) {
        return Transaction.builder()
                .tenantId(TENANT)
                .txnId(txnId)
                .transactionDate(date)
                .description(description)
                .amount(amount)
                .debitAccount(debit)
                .creditAccount(credit)
                .referenceCode(reference)
                .build();
    }

    /** A bank-credit payment: money leaves the bank account towards the given expense account. */
    public static Transaction createPayment(String txnId, LocalDate date, String description,
                                            double amount, String expenseAccount, String reference) {
        return createTransaction(txnId, date, description, amount, expenseAccount, BANK_ACCOUNT, reference);
    }

    public static Pattern createPattern(PatternFamily family, String knownAccount, List<String> keywords,
                                        String predicted, long occurrences, double confidence, LocalDate lastSeen) {
        String context = family.requiresBankLeg()
                ? family.getKeyPrefix() + "|" + knownAccount + "|" + String.join("-", keywords)
                : family.getKeyPrefix() + "|" + String.join("-", keywords);
        return Pattern.builder()
                .family(family)
                .patternKey(context + "->" + predicted)
                .knownAccount(knownAccount)
                .keywords(keywords)
                .predictedValue(predicted)
                .occurrences(occurrences)
                .averageAmount(10.0)
                .lastSeen(lastSeen)
                .confidence(confidence)
                .build();
    }

    public static PatternSet createPatternSet(String tenantId, Pattern... patterns) {
        PatternSet set = PatternSet.empty(tenantId, LocalDate.of(2024, 1, 1), LocalDate.of(2025, 12, 31));
        for (Pattern pattern : patterns) {
            set.getPatterns().get(pattern.getFamily()).put(pattern.getPatternKey(), pattern);
        }
        set.setTransactionCount(patterns.length);
        return set;
    }

    public static CachedPatternSet createCachedEntry(String tenantId, long minedAt, Pattern... patterns) {
        PatternSet set = createPatternSet(tenantId, patterns);
        MiningMetadata metadata = MiningMetadata.builder()
                .tenantId(tenantId)
                .lastMined(minedAt)
                .transactionCount(set.getTransactionCount())
                .cumulativeTransactionCount(set.getTransactionCount())
                .rangeFrom(set.getRangeFrom())
                .rangeTo(set.getRangeTo())
                .coveredFrom(set.getRangeFrom())
                .patternCount(set.patternCount())
                .build();
        return CachedPatternSet.builder()
                .tenantId(tenantId)
                .patternSet(set)
                .metadata(metadata)
                .insertedAt(minedAt)
                .lastAccessedAt(minedAt)
                .build();
    }
}
