package com.bank.patterns.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * A tenant's pattern set as held by a cache tier.
 *
 * insertedAt is the mining time of the set and travels unchanged between tiers, so a set
 * copied from the durable tier into memory keeps its original age.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CachedPatternSet {

    private String tenantId;
    private PatternSet patternSet;
    private MiningMetadata metadata;
    private long insertedAt;
    private long lastAccessedAt;

    // Only travels from the refresh path into the durable tier; never stored.
    @JsonIgnore
    private PatternDiff diff;

    public static CachedPatternSet from(MiningOutcome outcome) {
        long minedAt = outcome.getMetadata().getLastMined();
        return CachedPatternSet.builder()
                .tenantId(outcome.getMetadata().getTenantId())
                .patternSet(outcome.getPatternSet())
                .metadata(outcome.getMetadata())
                .insertedAt(minedAt)
                .lastAccessedAt(minedAt)
                .diff(outcome.getDiff())
                .build();
    }

    public boolean isExpired(long nowMillis, Duration ttl) {
        return nowMillis - insertedAt >= ttl.toMillis();
    }
}
