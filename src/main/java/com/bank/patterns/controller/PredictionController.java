package com.bank.patterns.controller;

import com.bank.patterns.model.PredictionResult;
import com.bank.patterns.model.Transaction;
import com.bank.patterns.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/predictions")
@Tag(name = "Predictions", description = "Fill missing accounts and reference codes from mined patterns")
public class PredictionController {

    private final PredictionService predictionService;

    public PredictionController(PredictionService predictionService) {
        this.predictionService = predictionService;
    }

    @Operation(summary = "Predict missing fields for a batch of transactions",
            description = "Returns copies of the submitted transactions with missing debit accounts, credit accounts " +
                    "and reference codes filled in where a pattern matches, plus a per-family report. " +
                    "When no patterns can be loaded the transactions come back unchanged and the report is " +
                    "marked unavailable.")
    @PostMapping("/{tenantId}")
    public ResponseEntity<?> predict(
            @Parameter(description = "Tenant ID", example = "TENANT-001")
            @PathVariable String tenantId,
            @RequestBody List<Transaction> transactions) {
        if (tenantId.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "tenantId must not be blank"));
        }
        if (transactions.stream().anyMatch(t -> t == null)) {
            return ResponseEntity.badRequest().body(Map.of("error", "transactions must not contain null entries"));
        }

        PredictionResult result = predictionService.apply(tenantId, transactions);
        return ResponseEntity.ok(result);
    }
}
