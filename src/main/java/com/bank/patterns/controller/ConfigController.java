package com.bank.patterns.controller;

import com.bank.patterns.config.PatternConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime pattern mining, cache and prediction settings")
public class ConfigController {

    private final PatternConfig patternConfig;

    public ConfigController(PatternConfig patternConfig) {
        this.patternConfig = patternConfig;
    }

    @Operation(summary = "Get pattern mining, cache and prediction settings")
    @GetMapping("/patterns")
    public ResponseEntity<Map<String, Object>> getPatternConfig() {
        return ResponseEntity.ok(Map.of(
                "windowDays", patternConfig.getWindowDays(),
                "stalenessHours", patternConfig.getStalenessHours(),
                "cacheTtlHours", patternConfig.getCache().getTtlHours(),
                "maxMemoryEntries", patternConfig.getCache().getMaxMemoryEntries(),
                "fileEnabled", patternConfig.getCache().isFileEnabled(),
                "minOccurrences", patternConfig.getPrediction().getMinOccurrences()
        ));
    }

    @Operation(summary = "Update pattern mining, cache and prediction settings",
            description = "Changes apply immediately but reset on restart. A smaller memory bound takes effect " +
                    "on the next insertion.")
    @PutMapping("/patterns")
    public ResponseEntity<?> updatePatternConfig(@RequestBody Map<String, Object> body) {
        int windowDays = toInt(body, "windowDays", patternConfig.getWindowDays());
        long staleness = toLong(body, "stalenessHours", patternConfig.getStalenessHours());
        long ttl = toLong(body, "cacheTtlHours", patternConfig.getCache().getTtlHours());
        int maxEntries = toInt(body, "maxMemoryEntries", patternConfig.getCache().getMaxMemoryEntries());
        boolean fileEnabled = toBoolean(body, "fileEnabled", patternConfig.getCache().isFileEnabled());
        long minOccurrences = toLong(body, "minOccurrences", patternConfig.getPrediction().getMinOccurrences());

        if (windowDays <= 0) return badRequest("windowDays must be > 0", "windowDays");
        if (staleness <= 0) return badRequest("stalenessHours must be > 0", "stalenessHours");
        if (ttl <= 0) return badRequest("cacheTtlHours must be > 0", "cacheTtlHours");
        if (maxEntries <= 0) return badRequest("maxMemoryEntries must be > 0", "maxMemoryEntries");
        if (minOccurrences < 1) return badRequest("minOccurrences must be >= 1", "minOccurrences");

        patternConfig.setWindowDays(windowDays);
        patternConfig.setStalenessHours(staleness);
        patternConfig.getCache().setTtlHours(ttl);
        patternConfig.getCache().setMaxMemoryEntries(maxEntries);
        patternConfig.getCache().setFileEnabled(fileEnabled);
        patternConfig.getPrediction().setMinOccurrences(minOccurrences);

        return getPatternConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
