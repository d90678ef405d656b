package com.bank.patterns.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of every pattern mined for one tenant over a date window.
 * Superseded as a whole on re-mining, never edited in place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "All patterns mined for a tenant, grouped by family and keyed by pattern key")
public class PatternSet {

    @Schema(description = "Tenant identifier", example = "TENANT-001")
    private String tenantId;

    @Builder.Default
    private Map<PatternFamily, Map<String, Pattern>> patterns = new EnumMap<>(PatternFamily.class);

    @Schema(description = "Transactions read from the ledger for this window, discarded ones included")
    private long transactionCount;

    @Schema(description = "Transactions skipped as malformed (both accounts missing or unusable amount)")
    private long discardedCount;

    private LocalDate rangeFrom;

    private LocalDate rangeTo;

    public static PatternSet empty(String tenantId, LocalDate rangeFrom, LocalDate rangeTo) {
        Map<PatternFamily, Map<String, Pattern>> families = new EnumMap<>(PatternFamily.class);
        for (PatternFamily family : PatternFamily.values()) {
            families.put(family, new TreeMap<>());
        }
        return PatternSet.builder()
                .tenantId(tenantId)
                .patterns(families)
                .rangeFrom(rangeFrom)
                .rangeTo(rangeTo)
                .build();
    }

    public Map<String, Pattern> family(PatternFamily family) {
        if (patterns == null) return Collections.emptyMap();
        Map<String, Pattern> byKey = patterns.get(family);
        return byKey != null ? byKey : Collections.emptyMap();
    }

    public Pattern find(String patternKey) {
        for (PatternFamily family : PatternFamily.values()) {
            Pattern pattern = family(family).get(patternKey);
            if (pattern != null) return pattern;
        }
        return null;
    }

    public int patternCount() {
        int count = 0;
        for (PatternFamily family : PatternFamily.values()) {
            count += family(family).size();
        }
        return count;
    }
}
