package com.bank.patterns.cache;

import com.aerospike.client.AerospikeException;
import com.bank.patterns.model.CacheLevel;
import com.bank.patterns.model.CachedPatternSet;
import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.Pattern;
import com.bank.patterns.model.PatternDiff;
import com.bank.patterns.model.PatternFamily;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.repository.MiningMetadataRepository;
import com.bank.patterns.repository.PatternRepository;
import com.bank.patterns.repository.StoredMiningMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Shared Aerospike tier and the source of truth across instances.
 *
 * Write order: the metadata record is deleted first, pattern rows are upserted or
 * deleted, and the metadata is written last with the new key index. A write that fails
 * half way leaves no metadata, which reads as a miss. Metadata whose rows are not all
 * present is also a miss.
 */
@Component
public class DurablePatternTier implements CacheTier {

    private static final Logger log = LoggerFactory.getLogger(DurablePatternTier.class);

    private final PatternRepository patternRepository;
    private final MiningMetadataRepository metadataRepository;
    private final Clock clock;

    public DurablePatternTier(PatternRepository patternRepository,
                              MiningMetadataRepository metadataRepository,
                              Clock clock) {
        this.patternRepository = patternRepository;
        this.metadataRepository = metadataRepository;
        this.clock = clock;
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.DURABLE;
    }

    @Override
    public Optional<CachedPatternSet> get(String tenantId) {
        try {
            StoredMiningMetadata stored = metadataRepository.find(tenantId);
            if (stored == null) {
                return Optional.empty();
            }
            MiningMetadata metadata = stored.metadata();

            PatternSet set = PatternSet.empty(tenantId, metadata.getRangeFrom(), metadata.getRangeTo());
            set.setTransactionCount(metadata.getTransactionCount());
            set.setDiscardedCount(metadata.getDiscardedCount());

            for (PatternFamily family : PatternFamily.values()) {
                List<String> keys = stored.keys(family);
                Map<String, Pattern> rows = patternRepository.findAll(tenantId, family, keys);
                if (rows.size() != keys.size()) {
                    log.warn("Tenant {} has mining metadata but {} of {} {} pattern rows are missing; treating as a miss",
                            tenantId, keys.size() - rows.size(), keys.size(), family);
                    return Optional.empty();
                }
                set.getPatterns().put(family, new TreeMap<>(rows));
            }

            return Optional.of(CachedPatternSet.builder()
                    .tenantId(tenantId)
                    .patternSet(set)
                    .metadata(metadata)
                    .insertedAt(metadata.getLastMined())
                    .lastAccessedAt(clock.millis())
                    .build());
        } catch (AerospikeException e) {
            throw new TierUnavailableException(CacheLevel.DURABLE, "Durable read failed for tenant " + tenantId, e);
        }
    }

    /**
     * Writes only the rows named by the entry's diff when the stored metadata is the
     * baseline that diff was computed against; otherwise every row is written.
     */
    @Override
    public void put(CachedPatternSet entry) {
        String tenantId = entry.getTenantId();
        PatternSet set = entry.getPatternSet();
        try {
            StoredMiningMetadata previous = metadataRepository.find(tenantId);
            PatternDiff diff = entry.getDiff();
            boolean partial = diff != null && previous != null
                    && diff.getBaselineMinedAt() == previous.metadata().getLastMined();
            Set<String> changed = partial ? diff.changedKeys() : null;

            if (previous != null) {
                metadataRepository.delete(tenantId);
            }

            int written = 0;
            int deleted = 0;
            Map<PatternFamily, List<String>> index = new EnumMap<>(PatternFamily.class);
            for (PatternFamily family : PatternFamily.values()) {
                Map<String, Pattern> current = set.family(family);
                for (Pattern pattern : current.values()) {
                    if (changed == null || changed.contains(pattern.getPatternKey())) {
                        patternRepository.save(tenantId, pattern);
                        written++;
                    }
                }
                if (previous != null) {
                    Set<String> superseded = new HashSet<>(previous.keys(family));
                    superseded.removeAll(current.keySet());
                    for (String key : superseded) {
                        patternRepository.delete(tenantId, family, key);
                        deleted++;
                    }
                }
                index.put(family, new ArrayList<>(current.keySet()));
            }

            metadataRepository.save(entry.getMetadata(), index);
            log.debug("Durable tier stored tenant {}: {} rows written, {} superseded rows deleted",
                    tenantId, written, deleted);
        } catch (AerospikeException e) {
            throw new TierUnavailableException(CacheLevel.DURABLE, "Durable write failed for tenant " + tenantId, e);
        }
    }

    @Override
    public void invalidate(String tenantId) {
        try {
            StoredMiningMetadata stored = metadataRepository.find(tenantId);
            if (stored == null) {
                return;
            }
            metadataRepository.delete(tenantId);
            for (PatternFamily family : PatternFamily.values()) {
                for (String key : stored.keys(family)) {
                    patternRepository.delete(tenantId, family, key);
                }
            }
        } catch (AerospikeException e) {
            throw new TierUnavailableException(CacheLevel.DURABLE, "Durable invalidation failed for tenant " + tenantId, e);
        }
    }

    @Override
    public boolean contains(String tenantId) {
        try {
            return metadataRepository.exists(tenantId);
        } catch (AerospikeException e) {
            throw new TierUnavailableException(CacheLevel.DURABLE, "Durable lookup failed for tenant " + tenantId, e);
        }
    }
}
