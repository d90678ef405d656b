package com.bank.patterns.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Bookkeeping of the latest mining run for a tenant")
public class MiningMetadata {

    private String tenantId;

    @Schema(description = "Completion time of the latest mining run, epoch milliseconds")
    private long lastMined;

    @Schema(description = "Transactions behind the current pattern set")
    private long transactionCount;

    @Schema(description = "Transactions covered across all mining runs; never decreases")
    private long cumulativeTransactionCount;

    @Schema(description = "First day of the current pattern set's window")
    private LocalDate rangeFrom;

    @Schema(description = "Last day of the current pattern set's window; never decreases")
    private LocalDate rangeTo;

    @Schema(description = "Earliest day ever covered for this tenant; never increases")
    private LocalDate coveredFrom;

    private int patternCount;

    private long discardedCount;
}
