package com.bank.patterns.service;

import com.bank.patterns.config.MetricsConfig;
import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.MiningOutcome;
import com.bank.patterns.model.MiningRun;
import com.bank.patterns.model.PatternDiff;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.RefreshMode;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Produces a new pattern set for a tenant.
 *
 * Flow:
 * 1. If the previous run is recent enough, merge only the newer transactions into it
 * 2. On any error there, or when not eligible, re-mine the full default window
 * 3. Diff the result against the previous set and carry the coverage counters forward
 *
 * Publishing the result into the cache tiers is left to the caller.
 */
@Service
public class PatternRefreshService {

    private static final Logger log = LoggerFactory.getLogger(PatternRefreshService.class);

    private final IncrementalPatternUpdater incrementalUpdater;
    private final PatternMiner patternMiner;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public PatternRefreshService(IncrementalPatternUpdater incrementalUpdater,
                                 PatternMiner patternMiner,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.incrementalUpdater = incrementalUpdater;
        this.patternMiner = patternMiner;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @param previous the latest known entry for the tenant, expired or not, or null
     */
    @Observed(name = "pattern.refresh", contextualName = "refresh-patterns")
    public MiningOutcome refresh(String tenantId, CachedPatternSet previous) {
        if (incrementalUpdater.isEligible(previous)) {
            try {
                MiningOutcome outcome = incrementalUpdater.refresh(tenantId, previous);
                record(outcome);
                return outcome;
            } catch (RuntimeException e) {
                log.warn("Incremental refresh failed for tenant {}, falling back to a full mine: {}",
                        tenantId, e.getMessage());
            }
        }
        MiningOutcome outcome = fullMine(tenantId, previous);
        record(outcome);
        return outcome;
    }

    private MiningOutcome fullMine(String tenantId, CachedPatternSet previous) {
        MiningMetadata before = previous != null ? previous.getMetadata() : null;
        LocalDate coveredUntil = before != null ? before.getRangeTo() : null;

        MiningRun run = patternMiner.mineDefaultWindow(tenantId, coveredUntil);
        PatternSet set = run.patternSet();

        PatternSet previousSet = previous != null ? previous.getPatternSet() : null;
        PatternDiff diff = PatternDiff.compute(previousSet, set, before != null ? before.getLastMined() : 0L);

        long cumulative = before != null
                ? before.getCumulativeTransactionCount() + run.newlyCoveredCount()
                : set.getTransactionCount();
        LocalDate rangeTo = set.getRangeTo();
        if (before != null && before.getRangeTo() != null && before.getRangeTo().isAfter(rangeTo)) {
            rangeTo = before.getRangeTo();
        }

        MiningMetadata metadata = MiningMetadata.builder()
                .tenantId(tenantId)
                .lastMined(clock.millis())
                .transactionCount(set.getTransactionCount())
                .cumulativeTransactionCount(cumulative)
                .rangeFrom(set.getRangeFrom())
                .rangeTo(rangeTo)
                .coveredFrom(IncrementalPatternUpdater.earliest(
                        before != null ? before.getCoveredFrom() : null, set.getRangeFrom()))
                .patternCount(set.patternCount())
                .discardedCount(set.getDiscardedCount())
                .build();

        return MiningOutcome.builder()
                .patternSet(set)
                .metadata(metadata)
                .diff(diff)
                .mode(RefreshMode.FULL)
                .transactionsFetched(set.getTransactionCount())
                .build();
    }

    private void record(MiningOutcome outcome) {
        metricsConfig.recordMiningRun(outcome.getMode().name().toLowerCase(), outcome.getPatternSet().patternCount());
        if (outcome.getMode() == RefreshMode.FULL) {
            metricsConfig.recordDiscarded("mining", outcome.getPatternSet().getDiscardedCount());
        }
    }
}
