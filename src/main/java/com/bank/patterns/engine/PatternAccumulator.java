package com.bank.patterns.engine;

import com.bank.patterns.model.Pattern;
import com.bank.patterns.model.PatternFamily;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.Transaction;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Running aggregates for one mining pass over a tenant's transactions.
 *
 * Both the full miner and the incremental updater feed transactions through this class;
 * the updater first seeds it with the aggregates of the previous pattern set. Counts and
 * dates carry over exactly, amounts through {@code average * occurrences}, so a seeded
 * pass agrees with a full pass over the same transactions up to floating-point rounding
 * of the averages. Not thread-safe.
 */
public class PatternAccumulator {

    private final String tenantId;
    private final KeywordNormalizer normalizer;
    private final Predicate<String> isBankAccount;
    private final LocalDate coveredUntil;

    private final Map<String, Aggregate> aggregates = new HashMap<>();
    private long transactionCount;
    private long discardedCount;
    private long newlyCoveredCount;

    /**
     * @param isBankAccount bank-account test for this tenant's accounts
     * @param coveredUntil  last day already counted by earlier runs, or null; transactions
     *                      dated after it are counted as newly covered
     */
    public PatternAccumulator(String tenantId, KeywordNormalizer normalizer,
                              Predicate<String> isBankAccount, LocalDate coveredUntil) {
        this.tenantId = tenantId;
        this.normalizer = normalizer;
        this.isBankAccount = isBankAccount;
        this.coveredUntil = coveredUntil;
    }

    public void seed(PatternSet previous) {
        transactionCount += previous.getTransactionCount();
        discardedCount += previous.getDiscardedCount();
        for (PatternFamily family : PatternFamily.values()) {
            for (Pattern pattern : previous.family(family).values()) {
                String context = PatternKeys.contextKey(family, pattern.getKnownAccount(), pattern.getKeywords());
                Aggregate aggregate = aggregates.computeIfAbsent(pattern.getPatternKey(),
                        k -> new Aggregate(family, context, pattern.getKnownAccount(),
                                pattern.getKeywords(), pattern.getPredictedValue()));
                aggregate.occurrences += pattern.getOccurrences();
                aggregate.amountSum += pattern.getAverageAmount() * pattern.getOccurrences();
                aggregate.seen(pattern.getLastSeen());
            }
        }
    }

    public void add(Transaction txn) {
        transactionCount++;
        LocalDate date = txn.getTransactionDate();
        if (coveredUntil == null || (date != null && date.isAfter(coveredUntil))) {
            newlyCoveredCount++;
        }
        if (txn.isMalformed()) {
            discardedCount++;
            return;
        }

        List<String> keywords = normalizer.extract(txn.getDescription());
        if (keywords.isEmpty()) {
            return;
        }

        String debit = account(txn.getDebitAccount());
        String credit = account(txn.getCreditAccount());
        boolean bothAccounts = !Transaction.isBlank(debit) && !Transaction.isBlank(credit);

        if (bothAccounts && isBankAccount.test(credit)) {
            record(PatternFamily.DEBIT, credit, keywords, debit, txn);
        }
        if (bothAccounts && isBankAccount.test(debit)) {
            record(PatternFamily.CREDIT, debit, keywords, credit, txn);
        }
        if (!Transaction.isBlank(txn.getReferenceCode())) {
            record(PatternFamily.REFERENCE, null, keywords, txn.getReferenceCode(), txn);
        }
    }

    private void record(PatternFamily family, String knownAccount, List<String> keywords,
                        String predicted, Transaction txn) {
        String context = PatternKeys.contextKey(family, knownAccount, keywords);
        Aggregate aggregate = aggregates.computeIfAbsent(PatternKeys.patternKey(context, predicted),
                k -> new Aggregate(family, context, knownAccount, keywords, predicted));
        aggregate.occurrences++;
        aggregate.amountSum += txn.getAmount();
        aggregate.seen(txn.getTransactionDate());
    }

    // Ledger exports pad account numbers; keys and the bank-account test use the trimmed id.
    private static String account(String raw) {
        return raw == null ? null : raw.trim();
    }

    public PatternSet build(LocalDate rangeFrom, LocalDate rangeTo) {
        Map<String, Long> contextTotals = new HashMap<>();
        for (Aggregate aggregate : aggregates.values()) {
            contextTotals.merge(aggregate.contextKey, aggregate.occurrences, Long::sum);
        }

        PatternSet set = PatternSet.empty(tenantId, rangeFrom, rangeTo);
        set.setTransactionCount(transactionCount);
        set.setDiscardedCount(discardedCount);

        for (Map.Entry<String, Aggregate> entry : aggregates.entrySet()) {
            Aggregate aggregate = entry.getValue();
            long total = contextTotals.get(aggregate.contextKey);
            double confidence = total == 0 ? 0.0 : (double) aggregate.occurrences / total;
            Pattern pattern = Pattern.builder()
                    .family(aggregate.family)
                    .patternKey(entry.getKey())
                    .knownAccount(aggregate.knownAccount)
                    .keywords(aggregate.keywords)
                    .predictedValue(aggregate.predicted)
                    .occurrences(aggregate.occurrences)
                    .averageAmount(aggregate.occurrences == 0 ? 0.0 : aggregate.amountSum / aggregate.occurrences)
                    .lastSeen(aggregate.lastSeen)
                    .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                    .build();
            set.getPatterns().computeIfAbsent(aggregate.family, f -> new TreeMap<>()).put(entry.getKey(), pattern);
        }
        return set;
    }

    public long getTransactionCount() {
        return transactionCount;
    }

    public long getDiscardedCount() {
        return discardedCount;
    }

    public long getNewlyCoveredCount() {
        return newlyCoveredCount;
    }

    private static final class Aggregate {
        private final PatternFamily family;
        private final String contextKey;
        private final String knownAccount;
        private final List<String> keywords;
        private final String predicted;
        private long occurrences;
        private double amountSum;
        private LocalDate lastSeen;

        private Aggregate(PatternFamily family, String contextKey, String knownAccount,
                          List<String> keywords, String predicted) {
            this.family = family;
            this.contextKey = contextKey;
            this.knownAccount = knownAccount;
            this.keywords = List.copyOf(keywords);
            this.predicted = predicted;
        }

        private void seen(LocalDate date) {
            if (date != null && (lastSeen == null || date.isAfter(lastSeen))) {
                lastSeen = date;
            }
        }
    }
}
