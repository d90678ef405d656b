package com.bank.patterns.engine;

import com.bank.patterns.config.PatternConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a free-text description into the keyword set used in pattern keys.
 *
 * Tokens are lower-cased runs of ASCII letters and digits. Tokens shorter than the
 * minimum length, stop-words and numeric-only tokens are dropped. The first
 * {@code maxKeywords} distinct tokens in description order are kept and returned sorted,
 * so word order never changes a key. Pure and immutable; safe to share.
 */
@Component
public class KeywordNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern NUMERIC = Pattern.compile("[0-9]+");

    private final Set<String> stopWords;
    private final int minTokenLength;
    private final int maxKeywords;

    public KeywordNormalizer(PatternConfig config) {
        PatternConfig.Keywords keywords = config.getKeywords();
        Set<String> words = new LinkedHashSet<>();
        for (String word : keywords.getStopWords()) {
            words.add(word.toLowerCase(Locale.ROOT));
        }
        this.stopWords = Collections.unmodifiableSet(words);
        this.minTokenLength = keywords.getMinTokenLength();
        this.maxKeywords = keywords.getMaxKeywords();
    }

    public List<String> extract(String description) {
        if (description == null || description.isBlank()) {
            return List.of();
        }
        Set<String> kept = new LinkedHashSet<>();
        for (String token : NON_ALPHANUMERIC.split(description.toLowerCase(Locale.ROOT))) {
            if (kept.size() == maxKeywords) break;
            if (token.length() < minTokenLength) continue;
            if (stopWords.contains(token)) continue;
            if (NUMERIC.matcher(token).matches()) continue;
            kept.add(token);
        }
        List<String> sorted = new ArrayList<>(kept);
        Collections.sort(sorted);
        return Collections.unmodifiableList(sorted);
    }

    public static int overlap(Collection<String> left, Collection<String> right) {
        if (left == null || right == null) return 0;
        int shared = 0;
        for (String keyword : left) {
            if (right.contains(keyword)) shared++;
        }
        return shared;
    }
}
