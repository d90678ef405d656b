package com.bank.patterns.model;

/**
 * A mined pattern set plus the number of transactions dated after the previously
 * covered range end, which feeds the cumulative coverage count.
 */
public record MiningRun(PatternSet patternSet, long newlyCoveredCount) {}
