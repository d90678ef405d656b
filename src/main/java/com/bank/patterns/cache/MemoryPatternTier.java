package com.bank.patterns.cache;

import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.model.CacheLevel;
import com.bank.patterns.model.CachedPatternSet;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-process tier: an access-ordered map bounded by {@code patterns.cache.max-memory-entries}.
 * Each insertion past the bound evicts the single least recently accessed tenant; an
 * insertion counts as an access, so among untouched entries the oldest goes first.
 * The monitor guards map bookkeeping only and is never held across I/O.
 */
@Component
public class MemoryPatternTier implements CacheTier {

    private final PatternConfig config;
    private final Clock clock;
    private final LinkedHashMap<String, CachedPatternSet> entries;
    private long evictions;

    public MemoryPatternTier(PatternConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedPatternSet> eldest) {
                boolean evict = size() > config.getCache().getMaxMemoryEntries();
                if (evict) evictions++;
                return evict;
            }
        };
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.MEMORY;
    }

    @Override
    public synchronized Optional<CachedPatternSet> get(String tenantId) {
        CachedPatternSet entry = entries.get(tenantId);
        if (entry == null) return Optional.empty();
        CachedPatternSet touched = entry.toBuilder().lastAccessedAt(clock.millis()).build();
        entries.replace(tenantId, touched);
        return Optional.of(touched);
    }

    /** Reads without updating recency, for serving a stale entry during a refresh. */
    public synchronized Optional<CachedPatternSet> peek(String tenantId) {
        // Iteration leaves access order alone; get() would not.
        for (Map.Entry<String, CachedPatternSet> entry : entries.entrySet()) {
            if (entry.getKey().equals(tenantId)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized void put(CachedPatternSet entry) {
        entries.put(entry.getTenantId(), entry.toBuilder().diff(null).lastAccessedAt(clock.millis()).build());
    }

    @Override
    public synchronized void invalidate(String tenantId) {
        entries.remove(tenantId);
    }

    @Override
    public synchronized boolean contains(String tenantId) {
        return entries.containsKey(tenantId);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long evictionCount() {
        return evictions;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
