package com.bank.patterns.repository;

public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String tenantId, Throwable cause) {
        super("Ledger unavailable for tenant " + tenantId, cause);
    }
}
