package com.bank.patterns.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-family summary of the predictions applied to a batch")
public class PredictionReport {

    @Builder.Default
    private Map<PatternFamily, FamilyStats> families = new EnumMap<>(PatternFamily.class);

    private int transactionsProcessed;

    private int totalPredictions;

    @Schema(description = "Transactions skipped as malformed")
    private long discardedCount;

    @Schema(description = "True when no pattern set could be obtained; transactions are returned unmodified")
    private boolean unavailable;

    @Schema(description = "Failed components when unavailable. Never contains transaction content.")
    private String failureDetail;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FamilyStats {
        private int predictions;
        private double averageConfidence;
    }
}
