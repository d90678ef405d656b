package com.bank.patterns.service;

import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.engine.KeywordNormalizer;
import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.MiningOutcome;
import com.bank.patterns.model.Pattern;
import com.bank.patterns.model.PatternFamily;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.RefreshMode;
import com.bank.patterns.model.Transaction;
import com.bank.patterns.repository.BankAccountRepository;
import com.bank.patterns.repository.LedgerReader;
import com.bank.patterns.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.bank.patterns.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IncrementalPatternUpdaterTest {

    private static final LocalDate WINDOW_START = LocalDate.of(2025, 1, 1);
    private static final LocalDate OLD_END = LocalDate.of(2026, 3, 1);
    private static final LocalDate YESTERDAY = LocalDate.of(2026, 3, 14);

    @Mock private LedgerReader ledgerReader;
    @Mock private BankAccountRepository bankAccountRepository;

    private MutableClock clock;
    private PatternMiner miner;
    private IncrementalPatternUpdater updater;

    @BeforeEach
    void setUp() {
        PatternConfig config = new PatternConfig();
        clock = MutableClock.at("2026-03-15T10:00:00Z");
        lenient().when(bankAccountRepository.findBankAccounts(TENANT)).thenReturn(Set.of(BANK_ACCOUNT, "1020"));
        miner = new PatternMiner(ledgerReader, new BankAccountClassifier(bankAccountRepository),
                new KeywordNormalizer(config), config, clock);
        updater = new IncrementalPatternUpdater(ledgerReader, miner, config, clock);
    }

    @Test
    void refresh_matchesFullMineOverUnionWindow() {
        List<Transaction> oldPart = history(WINDOW_START, OLD_END, 0);
        List<Transaction> newPart = history(OLD_END.plusDays(1), YESTERDAY, 1000);
        newPart.add(createPayment("NEW-ONLY", YESTERDAY, "Coolblue webshop order", 249.0, "4500", "ELEC"));
        List<Transaction> union = new ArrayList<>(oldPart);
        union.addAll(newPart);

        when(ledgerReader.read(TENANT, WINDOW_START, OLD_END)).thenReturn(oldPart);
        when(ledgerReader.read(TENANT, OLD_END.plusDays(1), YESTERDAY)).thenReturn(newPart);
        when(ledgerReader.read(TENANT, WINDOW_START, YESTERDAY)).thenReturn(union);

        PatternSet oldSet = miner.mine(TENANT, WINDOW_START, OLD_END);
        MiningOutcome outcome = updater.refresh(TENANT, entryFor(oldSet, clock.millis() - 3_600_000L));
        PatternSet full = miner.mine(TENANT, WINDOW_START, YESTERDAY);
        PatternSet incremental = outcome.getPatternSet();

        for (PatternFamily family : PatternFamily.values()) {
            assertThat(incremental.family(family).keySet()).isEqualTo(full.family(family).keySet());
            for (Pattern expected : full.family(family).values()) {
                Pattern actual = incremental.family(family).get(expected.getPatternKey());
                assertThat(actual.getConfidence()).isCloseTo(expected.getConfidence(), within(1e-9));
                assertThat(actual.getOccurrences()).isEqualTo(expected.getOccurrences());
                assertThat(actual.getLastSeen()).isEqualTo(expected.getLastSeen());
                assertThat(actual.getAverageAmount()).isCloseTo(expected.getAverageAmount(), within(1e-6));
            }
        }
        assertThat(incremental.getTransactionCount()).isEqualTo(full.getTransactionCount());
        assertThat(incremental.getDiscardedCount()).isEqualTo(full.getDiscardedCount());
        assertThat(incremental.getRangeFrom()).isEqualTo(WINDOW_START);
        assertThat(incremental.getRangeTo()).isEqualTo(YESTERDAY);
    }

    @Test
    void refresh_classifiesNewUpdatedAndUnchangedPatterns() {
        List<Transaction> oldPart = List.of(
                createPayment("T1", OLD_END, "Jumbo Utrecht", 20, "4200", null),
                createPayment("T2", OLD_END, "Shell station", 60, "4400", null));
        when(ledgerReader.read(TENANT, WINDOW_START, OLD_END)).thenReturn(oldPart);
        when(ledgerReader.read(TENANT, OLD_END.plusDays(1), YESTERDAY)).thenReturn(List.of(
                createPayment("T3", YESTERDAY, "Jumbo Utrecht", 30, "4200", null),
                createPayment("T4", YESTERDAY, "KPN factuur", 45, "4600", null)));

        PatternSet oldSet = miner.mine(TENANT, WINDOW_START, OLD_END);
        MiningOutcome outcome = updater.refresh(TENANT, entryFor(oldSet, clock.millis() - 60_000L));

        assertThat(outcome.getMode()).isEqualTo(RefreshMode.INCREMENTAL);
        assertThat(outcome.getDiff().getNewKeys()).containsExactly("debit|1010|factuur-kpn->4600");
        assertThat(outcome.getDiff().getUpdatedKeys()).containsExactly("debit|1010|jumbo-utrecht->4200");
        assertThat(outcome.getDiff().getUnchangedCount()).isEqualTo(1);
        assertThat(outcome.getDiff().getRemovedKeys()).isEmpty();
        assertThat(outcome.getDiff().isMaterial()).isTrue();
        assertThat(outcome.getTransactionsFetched()).isEqualTo(2);
    }

    @Test
    void refresh_extendsMetadataMonotonically() {
        when(ledgerReader.read(TENANT, WINDOW_START, OLD_END)).thenReturn(history(WINDOW_START, OLD_END, 0));
        List<Transaction> newPart = history(OLD_END.plusDays(1), YESTERDAY, 1000);
        when(ledgerReader.read(TENANT, OLD_END.plusDays(1), YESTERDAY)).thenReturn(newPart);

        PatternSet oldSet = miner.mine(TENANT, WINDOW_START, OLD_END);
        CachedPatternSet previous = entryFor(oldSet, clock.millis() - 60_000L);
        MiningOutcome outcome = updater.refresh(TENANT, previous);

        MiningMetadata before = previous.getMetadata();
        MiningMetadata after = outcome.getMetadata();
        assertThat(after.getLastMined()).isEqualTo(clock.millis());
        assertThat(after.getRangeTo()).isEqualTo(YESTERDAY);
        assertThat(after.getCoveredFrom()).isEqualTo(WINDOW_START);
        assertThat(after.getCumulativeTransactionCount())
                .isEqualTo(before.getCumulativeTransactionCount() + newPart.size());
        assertThat(after.getTransactionCount()).isGreaterThanOrEqualTo(before.getTransactionCount());
        assertThat(after.getPatternCount()).isEqualTo(outcome.getPatternSet().patternCount());
    }

    @Test
    void refresh_alreadyCoveredThroughYesterday_readsNothing() {
        PatternSet set = PatternSet.empty(TENANT, WINDOW_START, YESTERDAY);

        MiningOutcome outcome = updater.refresh(TENANT, entryFor(set, clock.millis() - 60_000L));

        verify(ledgerReader, never()).read(any(), any(), any());
        assertThat(outcome.getDiff().isMaterial()).isFalse();
        assertThat(outcome.getTransactionsFetched()).isZero();
    }

    @Test
    void isEligible_requiresRecentMetadata() {
        PatternSet set = PatternSet.empty(TENANT, WINDOW_START, OLD_END);
        CachedPatternSet recent = entryFor(set, clock.millis() - Duration.ofHours(23).toMillis());
        CachedPatternSet stale = entryFor(set, clock.millis() - Duration.ofHours(25).toMillis());

        assertThat(updater.isEligible(recent)).isTrue();
        assertThat(updater.isEligible(stale)).isFalse();
        assertThat(updater.isEligible(null)).isFalse();
        assertThat(updater.isEligible(recent.toBuilder().metadata(null).build())).isFalse();
    }

    @Test
    void isEligible_entryJustPastDefaultTtl_onlyEligibleAtTheBoundary() {
        PatternConfig defaults = new PatternConfig();
        Duration ttl = Duration.ofHours(defaults.getCache().getTtlHours());
        PatternSet set = PatternSet.empty(TENANT, WINDOW_START, OLD_END);
        CachedPatternSet atTtl = entryFor(set, clock.millis() - ttl.toMillis());
        CachedPatternSet pastTtl = entryFor(set, clock.millis() - ttl.toMillis() - 1);

        assertThat(atTtl.isExpired(clock.millis(), ttl)).isTrue();
        assertThat(updater.isEligible(atTtl)).isTrue();
        assertThat(pastTtl.isExpired(clock.millis(), ttl)).isTrue();
        assertThat(updater.isEligible(pastTtl)).isFalse();
    }

    @Test
    void isEligible_stalenessAboveTtl_expiredEntryStaysEligible() {
        PatternConfig config = new PatternConfig();
        config.setStalenessHours(48);
        IncrementalPatternUpdater lenientUpdater = new IncrementalPatternUpdater(ledgerReader, miner, config, clock);
        Duration ttl = Duration.ofHours(config.getCache().getTtlHours());
        CachedPatternSet expired = entryFor(PatternSet.empty(TENANT, WINDOW_START, OLD_END),
                clock.millis() - Duration.ofHours(30).toMillis());

        assertThat(expired.isExpired(clock.millis(), ttl)).isTrue();
        assertThat(lenientUpdater.isEligible(expired)).isTrue();
    }

    @Test
    void refresh_staleMetadata_isRejected() {
        PatternSet set = PatternSet.empty(TENANT, WINDOW_START, OLD_END);
        clock.advance(Duration.ofDays(2));

        assertThatThrownBy(() -> updater.refresh(TENANT, entryFor(set, 0L)))
                .isInstanceOf(IllegalStateException.class);
        verify(ledgerReader, never()).read(any(), any(), any());
    }

    /** Deterministic mix of bank-credit, bank-debit, reference-only and malformed transactions. */
    private static List<Transaction> history(LocalDate from, LocalDate to, int idOffset) {
        String[] descriptions = {"ALBERT HEIJN 1234 AMSTERDAM", "Jumbo Utrecht", "Shell station A2", "KPN factuur"};
        String[] expenses = {"4200", "4200", "4300", "4400", "4600"};
        List<Transaction> txns = new ArrayList<>();
        int i = idOffset;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(3)) {
            String description = descriptions[i % descriptions.length];
            String id = "T" + i;
            switch (i % 7) {
                case 5 -> txns.add(createTransaction(id, day, "Rente spaarrekening", 1.25, "1020", "8000", "INT"));
                case 6 -> txns.add(createTransaction(id, day, description, 5, null, null, "X"));
                default -> txns.add(createPayment(id, day, description, 10 + (i % 13) * 1.1,
                        expenses[i % expenses.length], i % 2 == 0 ? "REF" + (i % 3) : null));
            }
            i++;
        }
        return txns;
    }

    private static CachedPatternSet entryFor(PatternSet set, long minedAt) {
        MiningMetadata metadata = MiningMetadata.builder()
                .tenantId(TENANT)
                .lastMined(minedAt)
                .transactionCount(set.getTransactionCount())
                .cumulativeTransactionCount(set.getTransactionCount())
                .rangeFrom(set.getRangeFrom())
                .rangeTo(set.getRangeTo())
                .coveredFrom(set.getRangeFrom())
                .patternCount(set.patternCount())
                .discardedCount(set.getDiscardedCount())
                .build();
        return CachedPatternSet.builder()
                .tenantId(TENANT)
                .patternSet(set)
                .metadata(metadata)
                .insertedAt(minedAt)
                .lastAccessedAt(minedAt)
                .build();
    }
}
