package com.bank.patterns.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MiningOutcome {

    private PatternSet patternSet;
    private MiningMetadata metadata;
    private PatternDiff diff;
    private RefreshMode mode;

    // Transactions read from the ledger by this run.
    private long transactionsFetched;
}
