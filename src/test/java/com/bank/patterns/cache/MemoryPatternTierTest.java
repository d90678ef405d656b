package com.bank.patterns.cache;

import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.PatternDiff;
import com.bank.patterns.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.bank.patterns.testutil.TestDataFactory.createCachedEntry;
import static org.assertj.core.api.Assertions.assertThat;

class MemoryPatternTierTest {

    private MutableClock clock;
    private MemoryPatternTier tier;

    @BeforeEach
    void setUp() {
        PatternConfig config = new PatternConfig();
        config.getCache().setMaxMemoryEntries(2);
        clock = MutableClock.at("2026-03-15T10:00:00Z");
        tier = new MemoryPatternTier(config, clock);
    }

    @Test
    void put_beyondCapacity_evictsLeastRecentlyUsed() {
        tier.put(createCachedEntry("A", 1L));
        tier.put(createCachedEntry("B", 1L));
        tier.get("A");

        tier.put(createCachedEntry("C", 1L));

        assertThat(tier.contains("A")).isTrue();
        assertThat(tier.contains("B")).isFalse();
        assertThat(tier.contains("C")).isTrue();
        assertThat(tier.size()).isEqualTo(2);
        assertThat(tier.evictionCount()).isEqualTo(1);
    }

    @Test
    void peek_doesNotRefreshRecency() {
        tier.put(createCachedEntry("A", 1L));
        tier.put(createCachedEntry("B", 1L));
        assertThat(tier.peek("A")).isPresent();

        tier.put(createCachedEntry("C", 1L));

        assertThat(tier.contains("A")).isFalse();
        assertThat(tier.contains("B")).isTrue();
    }

    @Test
    void get_updatesLastAccessButKeepsMiningTime() {
        tier.put(createCachedEntry("A", 1_000L));
        clock.advance(Duration.ofMinutes(5));

        CachedPatternSet entry = tier.get("A").orElseThrow();

        assertThat(entry.getInsertedAt()).isEqualTo(1_000L);
        assertThat(entry.getLastAccessedAt()).isEqualTo(clock.millis());
    }

    @Test
    void put_dropsRefreshDiff() {
        CachedPatternSet entry = createCachedEntry("A", 1L).toBuilder()
                .diff(PatternDiff.builder().build())
                .build();

        tier.put(entry);

        assertThat(tier.peek("A").orElseThrow().getDiff()).isNull();
    }

    @Test
    void invalidate_removesOnlyThatTenant() {
        tier.put(createCachedEntry("A", 1L));
        tier.put(createCachedEntry("B", 1L));

        tier.invalidate("A");

        assertThat(tier.get("A")).isEmpty();
        assertThat(tier.get("B")).isPresent();
        assertThat(tier.evictionCount()).isZero();
    }
}
