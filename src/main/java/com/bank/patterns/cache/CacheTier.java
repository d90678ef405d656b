package com.bank.patterns.cache;

import com.bank.patterns.model.CacheLevel;
import com.bank.patterns.model.CachedPatternSet;

import java.util.Optional;

/**
 * One level of the pattern cache.
 *
 * Tiers store and return entries as they are; expiry is judged by the caller from
 * {@link CachedPatternSet#getInsertedAt()} so an expired entry can still seed an
 * incremental refresh. Store failures surface as {@link TierUnavailableException}.
 */
public interface CacheTier {

    CacheLevel level();

    Optional<CachedPatternSet> get(String tenantId);

    void put(CachedPatternSet entry);

    void invalidate(String tenantId);

    /** Presence check without side effects on recency or access time. */
    boolean contains(String tenantId);
}
