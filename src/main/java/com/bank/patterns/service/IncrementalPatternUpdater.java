package com.bank.patterns.service;

import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.engine.PatternAccumulator;
import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.MiningOutcome;
import com.bank.patterns.model.PatternDiff;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.RefreshMode;
import com.bank.patterns.model.Transaction;
import com.bank.patterns.repository.LedgerReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Brings a previous pattern set up to date without re-reading its window.
 *
 * The previous set's aggregates seed a {@link PatternAccumulator} and only the days after
 * its covered range are read from the ledger. Confidence is recomputed over the whole
 * union, so the result matches a full mine of the union window.
 */
@Service
public class IncrementalPatternUpdater {

    private static final Logger log = LoggerFactory.getLogger(IncrementalPatternUpdater.class);

    private final LedgerReader ledgerReader;
    private final PatternMiner patternMiner;
    private final PatternConfig config;
    private final Clock clock;

    public IncrementalPatternUpdater(LedgerReader ledgerReader,
                                     PatternMiner patternMiner,
                                     PatternConfig config,
                                     Clock clock) {
        this.ledgerReader = ledgerReader;
        this.patternMiner = patternMiner;
        this.config = config;
        this.clock = clock;
    }

    /**
     * True when the previous run left usable metadata and a pattern set, and mined
     * within the staleness bound.
     */
    public boolean isEligible(CachedPatternSet previous) {
        if (previous == null || previous.getPatternSet() == null) return false;
        MiningMetadata metadata = previous.getMetadata();
        if (metadata == null || metadata.getRangeFrom() == null || metadata.getRangeTo() == null) return false;
        long age = clock.millis() - metadata.getLastMined();
        return age >= 0 && age <= Duration.ofHours(config.getStalenessHours()).toMillis();
    }

    /**
     * @throws IllegalStateException when {@link #isEligible} does not hold; callers run a full mine instead
     */
    public MiningOutcome refresh(String tenantId, CachedPatternSet previous) {
        if (!isEligible(previous)) {
            throw new IllegalStateException("No recent mining metadata for tenant " + tenantId);
        }
        MiningMetadata before = previous.getMetadata();
        PatternSet previousSet = previous.getPatternSet();

        LocalDate from = before.getRangeTo().plusDays(1);
        LocalDate to = patternMiner.lastCompleteDay();
        List<Transaction> fresh = from.isAfter(to) ? List.of() : ledgerReader.read(tenantId, from, to);

        PatternAccumulator accumulator = patternMiner.newAccumulator(tenantId, before.getRangeTo());
        accumulator.seed(previousSet);
        fresh.forEach(accumulator::add);

        LocalDate rangeTo = to.isAfter(before.getRangeTo()) ? to : before.getRangeTo();
        PatternSet merged = accumulator.build(before.getRangeFrom(), rangeTo);
        PatternDiff diff = PatternDiff.compute(previousSet, merged, before.getLastMined());

        MiningMetadata after = MiningMetadata.builder()
                .tenantId(tenantId)
                .lastMined(clock.millis())
                .transactionCount(merged.getTransactionCount())
                .cumulativeTransactionCount(before.getCumulativeTransactionCount() + accumulator.getNewlyCoveredCount())
                .rangeFrom(merged.getRangeFrom())
                .rangeTo(merged.getRangeTo())
                .coveredFrom(earliest(before.getCoveredFrom(), merged.getRangeFrom()))
                .patternCount(merged.patternCount())
                .discardedCount(merged.getDiscardedCount())
                .build();

        log.info("Incremental refresh for tenant {}: {} new transactions, {} new / {} updated / {} unchanged patterns",
                tenantId, fresh.size(), diff.getNewKeys().size(), diff.getUpdatedKeys().size(), diff.getUnchangedCount());

        return MiningOutcome.builder()
                .patternSet(merged)
                .metadata(after)
                .diff(diff)
                .mode(RefreshMode.INCREMENTAL)
                .transactionsFetched(fresh.size())
                .build();
    }

    static LocalDate earliest(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }
}
