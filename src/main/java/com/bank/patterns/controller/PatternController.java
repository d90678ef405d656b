package com.bank.patterns.controller;

import com.bank.patterns.cache.MultiLevelPatternCache;
import com.bank.patterns.cache.PatternsUnavailableException;
import com.bank.patterns.model.MiningOutcome;
import com.bank.patterns.model.PatternSet;
import com.bank.patterns.model.RefreshStats;
import com.bank.patterns.model.RefreshSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/patterns")
@Tag(name = "Patterns", description = "Inspect, refresh and invalidate a tenant's mined patterns")
public class PatternController {

    private final MultiLevelPatternCache patternCache;

    public PatternController(MultiLevelPatternCache patternCache) {
        this.patternCache = patternCache;
    }

    @Operation(summary = "Get a tenant's current pattern set",
            description = "Served from the fastest cache tier holding a fresh copy; mines on a miss.")
    @GetMapping("/{tenantId}")
    public ResponseEntity<?> getPatterns(
            @Parameter(description = "Tenant ID", example = "TENANT-001")
            @PathVariable String tenantId) {
        try {
            PatternSet patterns = patternCache.get(tenantId);
            return ResponseEntity.ok(patterns);
        } catch (PatternsUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get cache and mining statistics for a tenant",
            description = "Hit rate, entries per tier, last mining time and pattern count. Read-only.")
    @GetMapping("/{tenantId}/stats")
    public ResponseEntity<RefreshStats> getStats(
            @Parameter(description = "Tenant ID", example = "TENANT-001")
            @PathVariable String tenantId) {
        return ResponseEntity.ok(patternCache.stats(tenantId));
    }

    @Operation(summary = "Refresh a tenant's patterns now",
            description = "Merges transactions booked since the last run when that run is recent enough, " +
                    "otherwise re-mines the full window. Returns what changed.")
    @PostMapping("/{tenantId}/refresh")
    public ResponseEntity<?> refresh(
            @Parameter(description = "Tenant ID", example = "TENANT-001")
            @PathVariable String tenantId) {
        try {
            MiningOutcome outcome = patternCache.refresh(tenantId);
            return ResponseEntity.ok(RefreshSummary.from(outcome));
        } catch (PatternsUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Invalidate a tenant's cached patterns",
            description = "Removes the tenant from every cache tier. The next lookup re-mines.")
    @DeleteMapping("/{tenantId}/cache")
    public ResponseEntity<Void> invalidate(
            @Parameter(description = "Tenant ID", example = "TENANT-001")
            @PathVariable String tenantId) {
        patternCache.invalidate(tenantId);
        return ResponseEntity.noContent().build();
    }
}
