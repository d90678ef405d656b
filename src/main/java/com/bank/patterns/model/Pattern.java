package com.bank.patterns.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A learned association between a known transaction side plus keywords and a predicted value")
public class Pattern {

    /**
     * Ranking among competing patterns: higher confidence first, then the most recent
     * last-seen date, then more occurrences. The key makes the order total.
     */
    public static final Comparator<Pattern> RANKING = Comparator
            .comparingDouble(Pattern::getConfidence).reversed()
            .thenComparing(Pattern::getLastSeen, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
            .thenComparing(Comparator.comparingLong(Pattern::getOccurrences).reversed())
            .thenComparing(Pattern::getPatternKey);

    private PatternFamily family;

    @Schema(description = "Composite key: family, known bank account, keywords and predicted value",
            example = "debit|1010|albert-amsterdam-heijn->4200")
    private String patternKey;

    @Schema(description = "Known bank account on the opposite side. Null for reference patterns.", example = "1010")
    private String knownAccount;

    @Schema(description = "Normalized description keywords, sorted", example = "[\"albert\", \"amsterdam\", \"heijn\"]")
    private List<String> keywords;

    @Schema(description = "Predicted account identifier or reference code", example = "4200")
    private String predictedValue;

    private long occurrences;

    private double averageAmount;

    private LocalDate lastSeen;

    @Schema(description = "Share of same-context transactions resolving to this value, in [0, 1]", example = "1.0")
    private double confidence;
}
