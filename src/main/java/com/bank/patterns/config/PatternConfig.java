package com.bank.patterns.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "patterns")
public class PatternConfig {

    // Size of the mining window, counted back from today.
    private int windowDays = 730;

    // Mining metadata older than this forces a full re-mine instead of an incremental refresh.
    // With the defaults a lazy refresh only starts once an entry reaches cache.ttl-hours, which
    // is the edge of this bound, so lazy refreshes are mostly full mines and the incremental
    // path is reached by POST /refresh. Set it above ttl-hours to make lazy refreshes incremental.
    private long stalenessHours = 24;

    private Cache cache = new Cache();

    private Keywords keywords = new Keywords();

    private Prediction prediction = new Prediction();

    @Data
    public static class Cache {
        // Entry time-to-live, measured from the mining time of the cached set.
        private long ttlHours = 24;
        // Fast tier capacity; the least recently used tenant is evicted beyond it.
        private int maxMemoryEntries = 1000;
        private boolean fileEnabled = true;
        private String fileDir = "cache/patterns";
    }

    @Data
    public static class Keywords {
        private int maxKeywords = 3;
        private int minTokenLength = 3;
        // Dutch and English noise words found in bank statement descriptions.
        private List<String> stopWords = List.of(
                "de", "het", "een", "van", "voor", "naar", "bij", "op", "in", "aan", "met",
                "en", "maar", "the", "a", "an", "of", "for", "to", "at", "on", "with", "by",
                "and", "or", "but");
    }

    @Data
    public static class Prediction {
        // Patterns seen fewer times than this are never applied.
        private long minOccurrences = 1;
    }
}
