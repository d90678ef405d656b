package com.bank.patterns.cache;

import java.util.List;

/**
 * Every tier and the miner failed and no earlier pattern set was available.
 * The message names the failed components only.
 */
public class PatternsUnavailableException extends RuntimeException {

    private final List<String> failedComponents;

    public PatternsUnavailableException(String tenantId, List<String> failedComponents, Throwable cause) {
        super("Patterns unavailable for tenant " + tenantId + "; failed: " + String.join(", ", failedComponents), cause);
        this.failedComponents = List.copyOf(failedComponents);
    }

    public List<String> getFailedComponents() {
        return failedComponents;
    }
}
