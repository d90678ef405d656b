package com.bank.patterns.model;

/**
 * Cache tiers in lookup order.
 */
public enum CacheLevel {
    MEMORY("memory"),
    DURABLE("durable"),
    FILE("file");

    private final String label;

    CacheLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
