package com.bank.patterns.cache;

import com.bank.patterns.config.MetricsConfig;
import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.model.CacheLevel;
import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.MiningOutcome;
import com.bank.patterns.model.PatternDiff;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.RefreshStats;
import com.bank.patterns.repository.LedgerUnavailableException;
import com.bank.patterns.repository.ReferenceDataUnavailableException;
import com.bank.patterns.service.PatternRefreshService;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-tier pattern cache in front of the miner: memory, then the durable store, then
 * the local file (consulted only when the durable store failed, since it is never
 * authoritative while the durable store answers).
 *
 * Per tenant:
 * - one mining lock, so at most one refresh runs at a time; callers arriving while it
 *   runs get the previous entry from any tier, expired or not, or wait if there is none
 * - a short state lock guarding the generation, the tombstone and the memory entry;
 *   it is never held across durable or file I/O, so memory hits never wait on them
 * - a publish lock ordering durable and file writes against invalidation deletes;
 *   lookups never take it
 * - an invalidation generation; a refresh that started before an invalidation returns
 *   its result but does not publish it, and a slow-tier read that raced with an
 *   invalidation is discarded
 *
 * Tier failures are logged, counted and treated as misses. Only when the miner also
 * fails and no earlier entry exists does a caller see {@link PatternsUnavailableException}.
 */
@Component
public class MultiLevelPatternCache {

    private static final Logger log = LoggerFactory.getLogger(MultiLevelPatternCache.class);

    private final MemoryPatternTier memoryTier;
    private final CacheTier durableTier;
    private final CacheTier fileTier;
    private final PatternRefreshService refreshService;
    private final PatternConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    private final Map<String, TenantState> tenants = new ConcurrentHashMap<>();
    private final Map<CacheLevel, AtomicLong> hits = new EnumMap<>(CacheLevel.class);
    private final Map<CacheLevel, AtomicLong> failures = new EnumMap<>(CacheLevel.class);
    private final Map<CacheLevel, AtomicLong> writes = new EnumMap<>(CacheLevel.class);
    private final AtomicLong misses = new AtomicLong();

    public MultiLevelPatternCache(MemoryPatternTier memoryTier,
                                  @Qualifier("durablePatternTier") CacheTier durableTier,
                                  @Qualifier("filePatternTier") CacheTier fileTier,
                                  PatternRefreshService refreshService,
                                  PatternConfig config,
                                  MetricsConfig metricsConfig,
                                  Tracer tracer,
                                  Clock clock) {
        this.memoryTier = memoryTier;
        this.durableTier = durableTier;
        this.fileTier = fileTier;
        this.refreshService = refreshService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
        for (CacheLevel level : CacheLevel.values()) {
            hits.put(level, new AtomicLong());
            failures.put(level, new AtomicLong());
            writes.put(level, new AtomicLong());
        }
    }

    public PatternSet get(String tenantId) {
        return getEntry(tenantId).getPatternSet();
    }

    public CachedPatternSet getEntry(String tenantId) {
        TenantState state = state(tenantId);
        Lookup lookup = lookup(tenantId, state, true);
        if (lookup.hit != null) {
            return lookup.hit;
        }
        misses.incrementAndGet();
        metricsConfig.recordCacheMiss();

        boolean waited = false;
        if (!state.miningLock.tryLock()) {
            CachedPatternSet previous = lookup.previous != null
                    ? lookup.previous
                    : memoryTier.peek(tenantId).orElse(null);
            if (previous != null) {
                log.debug("Refresh in flight for tenant {}; serving the previous pattern set", tenantId);
                return previous;
            }
            state.miningLock.lock();
            waited = true;
        }
        try {
            if (waited) {
                lookup = lookup(tenantId, state, false);
                if (lookup.hit != null) {
                    return lookup.hit;
                }
            }
            try {
                return CachedPatternSet.from(refreshAndPublish(tenantId, state, lookup));
            } catch (PatternsUnavailableException e) {
                if (lookup.previous != null) {
                    log.warn("Serving expired pattern set for tenant {} mined at {}: {}",
                            tenantId, lookup.previous.getInsertedAt(), e.getMessage());
                    return lookup.previous;
                }
                throw e;
            }
        } finally {
            state.miningLock.unlock();
        }
    }

    /**
     * Refreshes the tenant now, incrementally when eligible, and publishes the result.
     * Waits for a refresh already in flight.
     */
    public MiningOutcome refresh(String tenantId) {
        TenantState state = state(tenantId);
        state.miningLock.lock();
        try {
            Lookup lookup = lookup(tenantId, state, false);
            if (lookup.hit != null) {
                lookup.previous = lookup.hit;
            }
            return refreshAndPublish(tenantId, state, lookup);
        } finally {
            state.miningLock.unlock();
        }
    }

    /**
     * Stores a pattern set mined elsewhere as the tenant's current set in every tier.
     */
    public void put(String tenantId, PatternSet patternSet) {
        long cumulative = memoryTier.peek(tenantId)
                .map(e -> e.getMetadata().getCumulativeTransactionCount())
                .orElse(0L);
        MiningMetadata metadata = MiningMetadata.builder()
                .tenantId(tenantId)
                .lastMined(clock.millis())
                .transactionCount(patternSet.getTransactionCount())
                .cumulativeTransactionCount(Math.max(cumulative, patternSet.getTransactionCount()))
                .rangeFrom(patternSet.getRangeFrom())
                .rangeTo(patternSet.getRangeTo())
                .coveredFrom(patternSet.getRangeFrom())
                .patternCount(patternSet.patternCount())
                .discardedCount(patternSet.getDiscardedCount())
                .build();
        CachedPatternSet entry = CachedPatternSet.builder()
                .tenantId(tenantId)
                .patternSet(patternSet)
                .metadata(metadata)
                .insertedAt(metadata.getLastMined())
                .lastAccessedAt(metadata.getLastMined())
                .build();

        TenantState state = state(tenantId);
        publish(tenantId, state, state.generation.get(), entry);
    }

    /**
     * Removes the tenant from all tiers. Until the next refresh is published this process
     * does not read the durable or file tier for the tenant, even if removing from them failed.
     */
    public void invalidate(String tenantId) {
        TenantState state = state(tenantId);
        state.stateLock.lock();
        try {
            state.generation.incrementAndGet();
            state.invalidated = true;
            memoryTier.invalidate(tenantId);
            metricsConfig.updateMemoryEntries(memoryTier.size());
        } finally {
            state.stateLock.unlock();
        }

        state.publishLock.lock();
        try {
            quietly(CacheLevel.DURABLE, () -> durableTier.invalidate(tenantId), tenantId);
            quietly(CacheLevel.FILE, () -> fileTier.invalidate(tenantId), tenantId);
        } finally {
            state.publishLock.unlock();
        }
        log.info("Invalidated cached patterns for tenant {}", tenantId);
    }

    /** Read-only statistics; touches no recency or counters. */
    public RefreshStats stats(String tenantId) {
        long totalHits = 0;
        Map<CacheLevel, Long> hitCounts = new EnumMap<>(CacheLevel.class);
        Map<CacheLevel, Long> failureCounts = new EnumMap<>(CacheLevel.class);
        Map<CacheLevel, Long> writeCounts = new EnumMap<>(CacheLevel.class);
        for (CacheLevel level : CacheLevel.values()) {
            long levelHits = hits.get(level).get();
            totalHits += levelHits;
            hitCounts.put(level, levelHits);
            failureCounts.put(level, failures.get(level).get());
            writeCounts.put(level, writes.get(level).get());
        }
        long missCount = misses.get();
        long lookups = totalHits + missCount;
        double hitRate = lookups == 0 ? 0.0 : Math.round(totalHits * 10000.0 / lookups) / 100.0;

        Map<CacheLevel, Integer> entries = new EnumMap<>(CacheLevel.class);
        entries.put(CacheLevel.MEMORY, memoryTier.contains(tenantId) ? 1 : 0);
        entries.put(CacheLevel.DURABLE, containsQuietly(CacheLevel.DURABLE, durableTier, tenantId) ? 1 : 0);
        entries.put(CacheLevel.FILE, containsQuietly(CacheLevel.FILE, fileTier, tenantId) ? 1 : 0);

        MiningMetadata metadata = memoryTier.peek(tenantId)
                .map(CachedPatternSet::getMetadata)
                .orElseGet(() -> durableMetadata(tenantId));

        return RefreshStats.builder()
                .tenantId(tenantId)
                .hitRate(hitRate)
                .entriesPerTier(entries)
                .memoryEntries(memoryTier.size())
                .lastMined(metadata != null ? metadata.getLastMined() : null)
                .patternsDiscovered(metadata != null ? metadata.getPatternCount() : 0)
                .cumulativeTransactionCount(metadata != null ? metadata.getCumulativeTransactionCount() : 0)
                .discardedTransactions(metadata != null ? metadata.getDiscardedCount() : 0)
                .hits(hitCounts)
                .misses(missCount)
                .evictions(memoryTier.evictionCount())
                .tierFailures(failureCounts)
                .writes(writeCounts)
                .build();
    }

    // ── Lookup ──

    private Lookup lookup(String tenantId, TenantState state, boolean countHits) {
        Lookup result = new Lookup();
        Optional<CachedPatternSet> inMemory = memoryTier.get(tenantId);
        if (inMemory.isPresent()) {
            if (isFresh(inMemory.get())) {
                hit(CacheLevel.MEMORY, tenantId, countHits);
                result.hit = inMemory.get();
                return result;
            }
            result.previous = inMemory.get();
        }

        long generation = state.generation.get();
        if (state.invalidated) {
            return result;
        }

        boolean durableFailed = false;
        try {
            Optional<CachedPatternSet> durable = traced(CacheLevel.DURABLE, durableTier, tenantId);
            if (durable.isPresent() && accept(result, state, generation, CacheLevel.DURABLE, durable.get(), countHits)) {
                return result;
            }
        } catch (RuntimeException e) {
            durableFailed = true;
            failure(CacheLevel.DURABLE, tenantId, e);
            result.failed.add(CacheLevel.DURABLE.getLabel());
        }

        if (durableFailed) {
            try {
                Optional<CachedPatternSet> file = traced(CacheLevel.FILE, fileTier, tenantId);
                if (file.isPresent() && accept(result, state, generation, CacheLevel.FILE, file.get(), countHits)) {
                    return result;
                }
            } catch (RuntimeException e) {
                failure(CacheLevel.FILE, tenantId, e);
                result.failed.add(CacheLevel.FILE.getLabel());
            }
        }
        return result;
    }

    /**
     * Takes an entry read from a slow tier into the lookup. Returns true on a fresh hit,
     * which is also written back to memory. An entry read across an invalidation is dropped.
     */
    private boolean accept(Lookup result, TenantState state, long generation,
                           CacheLevel level, CachedPatternSet entry, boolean countHits) {
        state.stateLock.lock();
        try {
            if (state.generation.get() != generation) {
                log.debug("Dropping {} tier read for tenant {}; invalidated meanwhile",
                        level.getLabel(), entry.getTenantId());
                return false;
            }
            if (!isFresh(entry)) {
                result.previous = newer(result.previous, entry);
                return false;
            }
            hit(level, entry.getTenantId(), countHits);
            writeBack(entry);
            result.hit = entry;
            return true;
        } finally {
            state.stateLock.unlock();
        }
    }

    private Optional<CachedPatternSet> traced(CacheLevel level, CacheTier tier, String tenantId) {
        Span span = tracer.nextSpan().name("pattern-cache-" + level.getLabel())
                .tag("tenant", tenantId)
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return tier.get(tenantId);
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void writeBack(CachedPatternSet entry) {
        long evictedBefore = memoryTier.evictionCount();
        memoryTier.put(entry);
        writes.get(CacheLevel.MEMORY).incrementAndGet();
        recordEvictions(evictedBefore);
    }

    // ── Refresh and publish ──

    private MiningOutcome refreshAndPublish(String tenantId, TenantState state, Lookup lookup) {
        long generation = state.generation.get();
        MiningOutcome outcome;
        try {
            outcome = refreshService.refresh(tenantId, lookup.previous);
        } catch (RuntimeException e) {
            List<String> failed = new ArrayList<>(lookup.failed);
            failed.add(componentOf(e));
            log.error("Pattern refresh failed for tenant {}; failed components: {}", tenantId, failed, e);
            throw new PatternsUnavailableException(tenantId, failed, e);
        }
        publish(tenantId, state, generation, CachedPatternSet.from(outcome));
        return outcome;
    }

    private void publish(String tenantId, TenantState state, long generation, CachedPatternSet entry) {
        PatternDiff diff = entry.getDiff();
        boolean material = diff == null || diff.isMaterial();

        state.publishLock.lock();
        try {
            if (state.generation.get() != generation) {
                log.info("Tenant {} was invalidated while mining; the new pattern set is not cached", tenantId);
                return;
            }
            // The memory entry keeps serving until the new set replaces it below.
            if (material) {
                quietly(CacheLevel.FILE, () -> fileTier.invalidate(tenantId), tenantId);
            }

            boolean durableStored = quietly(CacheLevel.DURABLE, () -> durableTier.put(entry), tenantId);
            if (durableStored) {
                writes.get(CacheLevel.DURABLE).incrementAndGet();
            }

            state.stateLock.lock();
            try {
                // An invalidation that arrived during the durable write deletes it once we release.
                if (state.generation.get() != generation) {
                    log.info("Tenant {} was invalidated while publishing; the new pattern set is not cached", tenantId);
                    return;
                }
                if (durableStored) {
                    state.invalidated = false;
                }
                writeBack(entry);
                metricsConfig.updateMemoryEntries(memoryTier.size());
            } finally {
                state.stateLock.unlock();
            }

            if (quietly(CacheLevel.FILE, () -> fileTier.put(entry), tenantId)) {
                writes.get(CacheLevel.FILE).incrementAndGet();
            }
            log.info("Published {} patterns for tenant {} (mined at {})",
                    entry.getPatternSet().patternCount(), tenantId, entry.getInsertedAt());
        } finally {
            state.publishLock.unlock();
        }
    }

    // ── Helpers ──

    private boolean isFresh(CachedPatternSet entry) {
        return !entry.isExpired(clock.millis(), Duration.ofHours(config.getCache().getTtlHours()));
    }

    private void hit(CacheLevel level, String tenantId, boolean count) {
        log.debug("Pattern cache hit for tenant {} at {} tier", tenantId, level.getLabel());
        if (!count) return;
        hits.get(level).incrementAndGet();
        metricsConfig.recordCacheHit(level.getLabel());
    }

    private void failure(CacheLevel level, String tenantId, RuntimeException e) {
        failures.get(level).incrementAndGet();
        metricsConfig.recordTierFailure(level.getLabel());
        log.warn("Pattern cache {} tier failed for tenant {}; treating as a miss: {}",
                level.getLabel(), tenantId, e.getMessage());
    }

    private boolean quietly(CacheLevel level, Runnable action, String tenantId) {
        try {
            action.run();
            return true;
        } catch (RuntimeException e) {
            failure(level, tenantId, e);
            return false;
        }
    }

    private boolean containsQuietly(CacheLevel level, CacheTier tier, String tenantId) {
        try {
            return tier.contains(tenantId);
        } catch (RuntimeException e) {
            log.debug("Could not check {} tier for tenant {}: {}", level.getLabel(), tenantId, e.getMessage());
            return false;
        }
    }

    private MiningMetadata durableMetadata(String tenantId) {
        try {
            return durableTier.get(tenantId).map(CachedPatternSet::getMetadata).orElse(null);
        } catch (RuntimeException e) {
            log.debug("Could not read durable metadata for tenant {}: {}", tenantId, e.getMessage());
            return null;
        }
    }

    private void recordEvictions(long evictedBefore) {
        long evicted = memoryTier.evictionCount() - evictedBefore;
        for (long i = 0; i < evicted; i++) {
            metricsConfig.recordEviction();
        }
    }

    private static String componentOf(RuntimeException e) {
        if (e instanceof LedgerUnavailableException) return "ledger";
        if (e instanceof ReferenceDataUnavailableException) return "bank-accounts";
        return "miner";
    }

    private static CachedPatternSet newer(CachedPatternSet current, CachedPatternSet candidate) {
        if (current == null) return candidate;
        return candidate.getInsertedAt() > current.getInsertedAt() ? candidate : current;
    }

    private TenantState state(String tenantId) {
        return tenants.computeIfAbsent(tenantId, id -> new TenantState());
    }

    private static final class TenantState {
        private final ReentrantLock miningLock = new ReentrantLock();
        private final ReentrantLock stateLock = new ReentrantLock();
        private final ReentrantLock publishLock = new ReentrantLock();
        private final AtomicLong generation = new AtomicLong();
        private volatile boolean invalidated;
    }

    private static final class Lookup {
        private CachedPatternSet hit;
        private CachedPatternSet previous;
        private final List<String> failed = new ArrayList<>();
    }
}
