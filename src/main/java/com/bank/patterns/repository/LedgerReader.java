package com.bank.patterns.repository;

import com.bank.patterns.model.Transaction;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only, tenant-scoped view of the historical ledger.
 */
public interface LedgerReader {

    /**
     * Transactions booked for the tenant between both dates, inclusive.
     *
     * @throws LedgerUnavailableException when the ledger cannot be read within its timeout
     */
    List<Transaction> read(String tenantId, LocalDate from, LocalDate to);
}
