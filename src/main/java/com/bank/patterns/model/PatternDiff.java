package com.bank.patterns.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classification of each pattern key after a mining run relative to the set it replaces.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternDiff {

    private static final double TOLERANCE = 1e-9;

    @Builder.Default
    private List<String> newKeys = new ArrayList<>();

    @Builder.Default
    private List<String> updatedKeys = new ArrayList<>();

    @Builder.Default
    private List<String> removedKeys = new ArrayList<>();

    private int unchangedCount;

    /** lastMined of the set this diff was computed against, 0 when there was none. */
    private long baselineMinedAt;

    @JsonIgnore
    public boolean isMaterial() {
        return !newKeys.isEmpty() || !updatedKeys.isEmpty() || !removedKeys.isEmpty();
    }

    /** Keys whose stored rows have to be rewritten. */
    public Set<String> changedKeys() {
        Set<String> keys = new TreeSet<>(newKeys);
        keys.addAll(updatedKeys);
        return keys;
    }

    public static PatternDiff compute(PatternSet previous, PatternSet current, long baselineMinedAt) {
        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        int unchanged = 0;

        for (PatternFamily family : PatternFamily.values()) {
            Map<String, Pattern> before = previous != null ? previous.family(family) : Map.of();
            Map<String, Pattern> after = current.family(family);

            for (Map.Entry<String, Pattern> entry : after.entrySet()) {
                Pattern old = before.get(entry.getKey());
                if (old == null) {
                    added.add(entry.getKey());
                } else if (changed(old, entry.getValue())) {
                    updated.add(entry.getKey());
                } else {
                    unchanged++;
                }
            }
            Set<String> gone = new TreeSet<>(before.keySet());
            gone.removeAll(after.keySet());
            removed.addAll(gone);
        }

        return PatternDiff.builder()
                .newKeys(added)
                .updatedKeys(updated)
                .removedKeys(removed)
                .unchangedCount(unchanged)
                .baselineMinedAt(previous != null ? baselineMinedAt : 0L)
                .build();
    }

    private static boolean changed(Pattern old, Pattern now) {
        return old.getOccurrences() != now.getOccurrences()
                || !Objects.equals(old.getLastSeen(), now.getLastSeen())
                || Math.abs(old.getConfidence() - now.getConfidence()) > TOLERANCE
                || Math.abs(old.getAverageAmount() - now.getAverageAmount()) > TOLERANCE;
    }
}
