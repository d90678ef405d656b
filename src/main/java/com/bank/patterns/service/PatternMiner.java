package com.bank.patterns.service;

import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.engine.KeywordNormalizer;
import com.bank.patterns.engine.PatternAccumulator;
import com.bank.patterns.model.MiningRun;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.Transaction;
import com.bank.patterns.repository.LedgerReader;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Mines debit, credit and reference patterns from a window of a tenant's ledger.
 *
 * The default window is the last {@code patterns.window-days} complete days, ending
 * yesterday, so an incremental refresh can pick up from the next day without counting
 * any transaction twice.
 */
@Service
public class PatternMiner {

    private static final Logger log = LoggerFactory.getLogger(PatternMiner.class);

    private final LedgerReader ledgerReader;
    private final BankAccountClassifier bankAccountClassifier;
    private final KeywordNormalizer keywordNormalizer;
    private final PatternConfig config;
    private final Clock clock;

    public PatternMiner(LedgerReader ledgerReader,
                        BankAccountClassifier bankAccountClassifier,
                        KeywordNormalizer keywordNormalizer,
                        PatternConfig config,
                        Clock clock) {
        this.ledgerReader = ledgerReader;
        this.bankAccountClassifier = bankAccountClassifier;
        this.keywordNormalizer = keywordNormalizer;
        this.config = config;
        this.clock = clock;
    }

    public PatternSet mine(String tenantId, LocalDate windowStart, LocalDate windowEnd) {
        return run(tenantId, windowStart, windowEnd, null).patternSet();
    }

    /**
     * Mines the default window.
     *
     * @param coveredUntil end of the range already covered by earlier runs, or null
     */
    @Observed(name = "pattern.mine", contextualName = "mine-patterns")
    public MiningRun mineDefaultWindow(String tenantId, LocalDate coveredUntil) {
        LocalDate windowEnd = lastCompleteDay();
        LocalDate windowStart = windowEnd.minusDays(config.getWindowDays() - 1L);
        return run(tenantId, windowStart, windowEnd, coveredUntil);
    }

    MiningRun run(String tenantId, LocalDate windowStart, LocalDate windowEnd, LocalDate coveredUntil) {
        if (windowStart.isAfter(windowEnd)) {
            throw new IllegalArgumentException("Window start " + windowStart + " is after window end " + windowEnd);
        }
        long started = clock.millis();
        List<Transaction> transactions = ledgerReader.read(tenantId, windowStart, windowEnd);

        PatternAccumulator accumulator = newAccumulator(tenantId, coveredUntil);
        transactions.forEach(accumulator::add);
        PatternSet set = accumulator.build(windowStart, windowEnd);

        log.info("Mined {} patterns for tenant {} from {} transactions ({} discarded) between {} and {} in {}ms",
                set.patternCount(), tenantId, transactions.size(), set.getDiscardedCount(),
                windowStart, windowEnd, clock.millis() - started);
        return new MiningRun(set, accumulator.getNewlyCoveredCount());
    }

    /**
     * @throws com.bank.patterns.repository.ReferenceDataUnavailableException when the
     *         tenant's bank accounts cannot be loaded
     */
    public PatternAccumulator newAccumulator(String tenantId, LocalDate coveredUntil) {
        Set<String> bankAccounts = bankAccountClassifier.bankAccounts(tenantId);
        return new PatternAccumulator(tenantId, keywordNormalizer, bankAccounts::contains, coveredUntil);
    }

    public LocalDate lastCompleteDay() {
        return LocalDate.now(clock).minusDays(1);
    }
}
