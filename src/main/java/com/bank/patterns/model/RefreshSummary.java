package com.bank.patterns.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a forced pattern refresh")
public class RefreshSummary {

    private String tenantId;

    @Schema(description = "FULL for a re-mine of the whole window, INCREMENTAL for a merge of new transactions")
    private RefreshMode mode;

    private long transactionsFetched;

    private int newPatterns;

    private int updatedPatterns;

    private int unchangedPatterns;

    private int removedPatterns;

    private int patternCount;

    private long lastMined;

    public static RefreshSummary from(MiningOutcome outcome) {
        PatternDiff diff = outcome.getDiff();
        return RefreshSummary.builder()
                .tenantId(outcome.getMetadata().getTenantId())
                .mode(outcome.getMode())
                .transactionsFetched(outcome.getTransactionsFetched())
                .newPatterns(diff.getNewKeys().size())
                .updatedPatterns(diff.getUpdatedKeys().size())
                .unchangedPatterns(diff.getUnchangedCount())
                .removedPatterns(diff.getRemovedKeys().size())
                .patternCount(outcome.getPatternSet().patternCount())
                .lastMined(outcome.getMetadata().getLastMined())
                .build();
    }
}
