package com.bank.patterns.cache;

import com.bank.patterns.model.CacheLevel;

public class TierUnavailableException extends RuntimeException {

    private final CacheLevel level;

    public TierUnavailableException(CacheLevel level, String message, Throwable cause) {
        super(message, cause);
        this.level = level;
    }

    public CacheLevel getLevel() {
        return level;
    }
}
