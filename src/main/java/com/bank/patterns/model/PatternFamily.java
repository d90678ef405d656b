package com.bank.patterns.model;

/**
 * The three pattern families, named after the field they predict.
 */
public enum PatternFamily {

    /** Predicts the debit account when the credit side is a known bank account. */
    DEBIT("debit"),

    /** Predicts the credit account when the debit side is a known bank account. */
    CREDIT("credit"),

    /** Predicts the reference code from description keywords alone. */
    REFERENCE("reference");

    private final String keyPrefix;

    PatternFamily(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public boolean requiresBankLeg() {
        return this != REFERENCE;
    }
}
