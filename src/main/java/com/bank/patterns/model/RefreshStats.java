package com.bank.patterns.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Cache and mining statistics for a tenant")
public class RefreshStats {

    private String tenantId;

    @Schema(description = "Process-wide cache hit rate in percent", example = "87.5")
    private double hitRate;

    @Schema(description = "Entries held for this tenant per tier (0 or 1)")
    @Builder.Default
    private Map<CacheLevel, Integer> entriesPerTier = new EnumMap<>(CacheLevel.class);

    @Schema(description = "Tenants currently held in the memory tier")
    private int memoryEntries;

    @Schema(description = "Latest mining time, epoch milliseconds. Null if never mined.")
    private Long lastMined;

    private int patternsDiscovered;

    private long cumulativeTransactionCount;

    @Builder.Default
    private Map<CacheLevel, Long> hits = new EnumMap<>(CacheLevel.class);

    private long misses;

    private long evictions;

    @Builder.Default
    private Map<CacheLevel, Long> tierFailures = new EnumMap<>(CacheLevel.class);

    @Builder.Default
    private Map<CacheLevel, Long> writes = new EnumMap<>(CacheLevel.class);

    @Schema(description = "Malformed transactions skipped by the latest mining run")
    private long discardedTransactions;
}
