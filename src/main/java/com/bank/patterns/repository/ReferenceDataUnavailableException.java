package com.bank.patterns.repository;

public class ReferenceDataUnavailableException extends RuntimeException {

    public ReferenceDataUnavailableException(String tenantId, Throwable cause) {
        super("Bank-account reference data unavailable for tenant " + tenantId, cause);
    }
}
