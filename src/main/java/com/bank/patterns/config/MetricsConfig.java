package com.bank.patterns.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger memoryEntries;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.memoryEntries = registry.gauge("pattern.cache.memory.entries", new AtomicInteger(0));
    }

    public void recordCacheHit(String tier) {
        Counter.builder("pattern.cache.hit.count")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordCacheMiss() {
        Counter.builder("pattern.cache.miss.count")
                .register(registry)
                .increment();
    }

    public void recordEviction() {
        Counter.builder("pattern.cache.eviction.count")
                .register(registry)
                .increment();
    }

    public void recordTierFailure(String tier) {
        Counter.builder("pattern.cache.tier.failure.count")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordMiningRun(String mode, int patternCount) {
        Counter.builder("pattern.mining.run.count")
                .tag("mode", mode)
                .register(registry)
                .increment();

        DistributionSummary.builder("pattern.mining.pattern_count")
                .tag("mode", mode)
                .register(registry)
                .record(patternCount);
    }

    public void recordPrediction(String family, double confidence) {
        Counter.builder("prediction.applied.count")
                .tag("family", family)
                .register(registry)
                .increment();

        DistributionSummary.builder("prediction.confidence")
                .tag("family", family)
                .register(registry)
                .record(confidence);
    }

    public void recordDiscarded(String stage, long count) {
        if (count <= 0) return;
        Counter.builder("transaction.discarded.count")
                .tag("stage", stage)
                .register(registry)
                .increment(count);
    }

    public void updateMemoryEntries(int count) {
        memoryEntries.set(count);
    }
}
