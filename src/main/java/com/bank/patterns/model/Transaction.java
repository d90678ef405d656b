package com.bank.patterns.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A ledger transaction, either read from history or submitted for prediction")
public class Transaction {

    @Schema(description = "Tenant identifier", example = "TENANT-001")
    private String tenantId;

    @Schema(description = "Transaction identifier", example = "TXN-000001")
    private String txnId;

    @Schema(description = "Booking date", example = "2026-03-14")
    private LocalDate transactionDate;

    @Schema(description = "Free-text description from the bank statement", example = "ALBERT HEIJN 1234 AMSTERDAM")
    private String description;

    @Schema(description = "Monetary amount. Null when missing or unparseable.", example = "42.17")
    private Double amount;

    @Schema(description = "Debit account identifier", example = "4200")
    private String debitAccount;

    @Schema(description = "Credit account identifier", example = "1010")
    private String creditAccount;

    @Schema(description = "Reference code", example = "GROCERIES")
    private String referenceCode;

    @Builder.Default
    @Schema(description = "Confidence of each field filled in by prediction, keyed by pattern family")
    private Map<PatternFamily, Double> predictionConfidence = new EnumMap<>(PatternFamily.class);

    /**
     * A transaction missing both accounts, or without a usable amount, is skipped by
     * mining and prediction and counted as discarded.
     */
    @JsonIgnore
    public boolean isMalformed() {
        return (isBlank(debitAccount) && isBlank(creditAccount)) || amount == null
                || amount.isNaN() || amount.isInfinite();
    }

    public boolean hasMissingField() {
        return isBlank(debitAccount) || isBlank(creditAccount) || isBlank(referenceCode);
    }

    /** Applied confidence for a family, 0.0 when nothing was predicted for it. */
    public double confidenceFor(PatternFamily family) {
        if (predictionConfidence == null) return 0.0;
        return predictionConfidence.getOrDefault(family, 0.0);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
