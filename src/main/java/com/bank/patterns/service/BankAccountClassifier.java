package com.bank.patterns.service;

import com.bank.patterns.repository.BankAccountRepository;
import com.bank.patterns.repository.ReferenceDataUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers whether an account is a bank or cash account for a tenant.
 *
 * Each tenant's reference set is loaded once and kept for the life of the process.
 * A failed load is not cached and is retried on the next call.
 *
 * {@link #isBankAccount} answers false for unknown accounts, blank identifiers and
 * unreadable reference data, so prediction never fails on it. Mining uses
 * {@link #bankAccounts} instead, which throws: a pass that cannot tell bank accounts
 * apart would drop every debit and credit pattern.
 */
@Service
public class BankAccountClassifier {

    private static final Logger log = LoggerFactory.getLogger(BankAccountClassifier.class);

    private final BankAccountRepository bankAccountRepository;
    private final Map<String, Set<String>> accountsByTenant = new ConcurrentHashMap<>();

    public BankAccountClassifier(BankAccountRepository bankAccountRepository) {
        this.bankAccountRepository = bankAccountRepository;
    }

    public boolean isBankAccount(String tenantId, String accountId) {
        if (accountId == null || accountId.isBlank()) {
            return false;
        }
        try {
            return bankAccounts(tenantId).contains(accountId.trim());
        } catch (ReferenceDataUnavailableException e) {
            log.warn("Could not load bank accounts for tenant {}; treating {} as a ledger account: {}",
                    tenantId, accountId, e.getCause().getMessage());
            return false;
        }
    }

    /**
     * @throws ReferenceDataUnavailableException when the reference set cannot be loaded
     */
    public Set<String> bankAccounts(String tenantId) {
        Set<String> cached = accountsByTenant.get(tenantId);
        if (cached != null) {
            return cached;
        }
        Set<String> loaded;
        try {
            loaded = Set.copyOf(bankAccountRepository.findBankAccounts(tenantId));
        } catch (RuntimeException e) {
            throw new ReferenceDataUnavailableException(tenantId, e);
        }
        Set<String> existing = accountsByTenant.putIfAbsent(tenantId, loaded);
        log.info("Loaded {} bank accounts for tenant {}", loaded.size(), tenantId);
        return existing != null ? existing : loaded;
    }

    /** Drops the cached reference set so the next call reloads it. */
    public void evict(String tenantId) {
        accountsByTenant.remove(tenantId);
    }
}
