package com.bank.patterns.service;

import com.bank.patterns.cache.MultiLevelPatternCache;
import com.bank.patterns.cache.PatternsUnavailableException;
import com.bank.patterns.config.MetricsConfig;
import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.engine.KeywordNormalizer;
import com.bank.patterns.model.Pattern;
import com.bank.patterns.model.PatternFamily;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.PredictionReport;
import com.bank.patterns.model.PredictionResult;
import com.bank.patterns.model.Transaction;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fills missing debit accounts, credit accounts and reference codes from a tenant's patterns.
 *
 * Flow:
 * 1. Copy every input transaction; the inputs are never modified
 * 2. Skip malformed transactions and count them as discarded
 * 3. Fetch the tenant's pattern set once, only if some transaction has a missing field
 * 4. Per missing field, pick the candidate with the largest keyword overlap, then by
 *    {@link Pattern#RANKING}, and record its confidence
 * 5. Summarize per family: prediction count and mean confidence
 *
 * If no pattern set can be obtained the copies come back unchanged with the report
 * marked unavailable.
 */
@Service
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final MultiLevelPatternCache patternCache;
    private final BankAccountClassifier bankAccountClassifier;
    private final KeywordNormalizer keywordNormalizer;
    private final PatternConfig config;
    private final MetricsConfig metricsConfig;

    public PredictionService(MultiLevelPatternCache patternCache,
                             BankAccountClassifier bankAccountClassifier,
                             KeywordNormalizer keywordNormalizer,
                             PatternConfig config,
                             MetricsConfig metricsConfig) {
        this.patternCache = patternCache;
        this.bankAccountClassifier = bankAccountClassifier;
        this.keywordNormalizer = keywordNormalizer;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "prediction.apply", contextualName = "apply-predictions")
    public PredictionResult apply(String tenantId, List<Transaction> transactions) {
        List<Transaction> copies = new ArrayList<>(transactions.size());
        for (Transaction txn : transactions) {
            copies.add(copy(txn));
        }

        long discarded = copies.stream().filter(Transaction::isMalformed).count();
        metricsConfig.recordDiscarded("prediction", discarded);
        boolean needsPatterns = copies.stream().anyMatch(t -> !t.isMalformed() && t.hasMissingField());

        Tally tally = new Tally();
        if (!needsPatterns) {
            return new PredictionResult(copies, tally.report(copies.size(), discarded));
        }

        PatternSet patterns;
        try {
            patterns = patternCache.get(tenantId);
        } catch (PatternsUnavailableException e) {
            log.warn("Predictions unavailable for tenant {}: {}", tenantId, e.getMessage());
            PredictionReport report = tally.report(copies.size(), discarded);
            report.setUnavailable(true);
            report.setFailureDetail(e.getMessage());
            return new PredictionResult(copies, report);
        }

        for (Transaction txn : copies) {
            if (txn.isMalformed() || !txn.hasMissingField()) continue;
            predict(tenantId, txn, patterns, tally);
        }

        PredictionReport report = tally.report(copies.size(), discarded);
        log.debug("Applied {} predictions to {} transactions for tenant {}",
                report.getTotalPredictions(), copies.size(), tenantId);
        return new PredictionResult(copies, report);
    }

    private void predict(String tenantId, Transaction txn, PatternSet patterns, Tally tally) {
        List<String> keywords = keywordNormalizer.extract(txn.getDescription());
        if (keywords.isEmpty()) return;

        if (Transaction.isBlank(txn.getDebitAccount())
                && bankAccountClassifier.isBankAccount(tenantId, txn.getCreditAccount())) {
            Pattern match = bestMatch(patterns, PatternFamily.DEBIT, txn.getCreditAccount().trim(), keywords);
            if (match != null) {
                txn.setDebitAccount(match.getPredictedValue());
                applied(txn, PatternFamily.DEBIT, match, tally);
            }
        }
        if (Transaction.isBlank(txn.getCreditAccount())
                && bankAccountClassifier.isBankAccount(tenantId, txn.getDebitAccount())) {
            Pattern match = bestMatch(patterns, PatternFamily.CREDIT, txn.getDebitAccount().trim(), keywords);
            if (match != null) {
                txn.setCreditAccount(match.getPredictedValue());
                applied(txn, PatternFamily.CREDIT, match, tally);
            }
        }
        if (Transaction.isBlank(txn.getReferenceCode())) {
            Pattern match = bestMatch(patterns, PatternFamily.REFERENCE, null, keywords);
            if (match != null) {
                txn.setReferenceCode(match.getPredictedValue());
                applied(txn, PatternFamily.REFERENCE, match, tally);
            }
        }
    }

    /**
     * Candidates share at least one keyword, meet the minimum support and, for account
     * families, were learned against the same bank account.
     */
    Pattern bestMatch(PatternSet patterns, PatternFamily family, String knownAccount, List<String> keywords) {
        long minOccurrences = config.getPrediction().getMinOccurrences();
        Pattern best = null;
        int bestOverlap = 0;

        for (Pattern candidate : patterns.family(family).values()) {
            if (candidate.getOccurrences() < minOccurrences) continue;
            if (family.requiresBankLeg() && !Objects.equals(candidate.getKnownAccount(), knownAccount)) continue;

            int overlap = KeywordNormalizer.overlap(keywords, candidate.getKeywords());
            if (overlap == 0) continue;

            if (best == null || overlap > bestOverlap
                    || (overlap == bestOverlap && Pattern.RANKING.compare(candidate, best) < 0)) {
                best = candidate;
                bestOverlap = overlap;
            }
        }
        return best;
    }

    private void applied(Transaction txn, PatternFamily family, Pattern match, Tally tally) {
        txn.getPredictionConfidence().put(family, match.getConfidence());
        tally.add(family, match.getConfidence());
        metricsConfig.recordPrediction(family.name().toLowerCase(), match.getConfidence());
    }

    private static Transaction copy(Transaction txn) {
        Map<PatternFamily, Double> confidence = new EnumMap<>(PatternFamily.class);
        if (txn.getPredictionConfidence() != null) {
            confidence.putAll(txn.getPredictionConfidence());
        }
        return txn.toBuilder().predictionConfidence(confidence).build();
    }

    private static final class Tally {
        private final Map<PatternFamily, Integer> counts = new EnumMap<>(PatternFamily.class);
        private final Map<PatternFamily, Double> confidenceSums = new EnumMap<>(PatternFamily.class);

        void add(PatternFamily family, double confidence) {
            counts.merge(family, 1, Integer::sum);
            confidenceSums.merge(family, confidence, Double::sum);
        }

        PredictionReport report(int processed, long discarded) {
            Map<PatternFamily, PredictionReport.FamilyStats> families = new EnumMap<>(PatternFamily.class);
            int total = 0;
            for (PatternFamily family : PatternFamily.values()) {
                int count = counts.getOrDefault(family, 0);
                double average = count == 0 ? 0.0 : confidenceSums.get(family) / count;
                families.put(family, new PredictionReport.FamilyStats(count, average));
                total += count;
            }
            return PredictionReport.builder()
                    .families(families)
                    .transactionsProcessed(processed)
                    .totalPredictions(total)
                    .discardedCount(discarded)
                    .build();
        }
    }
}
