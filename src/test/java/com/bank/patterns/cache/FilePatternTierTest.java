package com.bank.patterns.cache;

import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.model.CacheLevel;
import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.PatternDiff;
import com.bank.patterns.model.PatternFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static com.bank.patterns.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilePatternTierTest {

    @TempDir
    Path cacheDir;

    private PatternConfig config;
    private FilePatternTier tier;

    @BeforeEach
    void setUp() {
        config = new PatternConfig();
        config.getCache().setFileDir(cacheDir.toString());
        tier = new FilePatternTier(config);
    }

    @Test
    void putThenGet_restoresEntry() {
        CachedPatternSet entry = createCachedEntry(TENANT, 1_700_000_000_000L,
                createPattern(PatternFamily.DEBIT, BANK_ACCOUNT, List.of("albert", "heijn"), "4200", 7, 0.875,
                        LocalDate.of(2025, 12, 30)),
                createPattern(PatternFamily.REFERENCE, null, List.of("shell"), "FUEL", 3, 1.0,
                        LocalDate.of(2025, 11, 2)))
                .toBuilder()
                .diff(PatternDiff.builder().newKeys(List.of("x")).build())
                .build();

        tier.put(entry);
        CachedPatternSet restored = tier.get(TENANT).orElseThrow();

        assertThat(restored).isEqualTo(entry.toBuilder().diff(null).build());
        assertThat(restored.getInsertedAt()).isEqualTo(1_700_000_000_000L);
        assertThat(tier.contains(TENANT)).isTrue();
    }

    @Test
    void get_absentTenant_isEmpty() {
        assertThat(tier.get("UNKNOWN")).isEmpty();
        assertThat(tier.contains("UNKNOWN")).isFalse();
    }

    @Test
    void put_replacesPreviousFileWithoutLeavingTempFiles() throws Exception {
        tier.put(createCachedEntry(TENANT, 1L));
        tier.put(createCachedEntry(TENANT, 2L));

        assertThat(tier.get(TENANT).orElseThrow().getInsertedAt()).isEqualTo(2L);
        try (Stream<Path> files = Files.list(cacheDir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("TENANT-001.json");
        }
    }

    @Test
    void fileFor_encodesTenantIntoSingleFileName() {
        Path file = tier.fileFor("../acme/eu");

        assertThat(file.getParent()).isEqualTo(cacheDir);
        assertThat(file.getFileName().toString()).doesNotContain("/");
    }

    @Test
    void invalidate_removesFile() {
        tier.put(createCachedEntry(TENANT, 1L));

        tier.invalidate(TENANT);

        assertThat(tier.get(TENANT)).isEmpty();
        assertThat(Files.exists(tier.fileFor(TENANT))).isFalse();
    }

    @Test
    void get_corruptFile_throwsTierUnavailable() throws Exception {
        Files.writeString(tier.fileFor(TENANT), "{not json");

        assertThatThrownBy(() -> tier.get(TENANT))
                .isInstanceOf(TierUnavailableException.class)
                .satisfies(e -> assertThat(((TierUnavailableException) e).getLevel()).isEqualTo(CacheLevel.FILE));
    }

    @Test
    void disabled_everyCallIsANoOpMiss() {
        config.getCache().setFileEnabled(false);

        tier.put(createCachedEntry(TENANT, 1L));

        assertThat(tier.get(TENANT)).isEmpty();
        assertThat(tier.contains(TENANT)).isFalse();
        assertThat(Files.exists(tier.fileFor(TENANT))).isFalse();
    }
}
