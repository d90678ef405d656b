package com.bank.patterns.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.bank.patterns.config.AerospikeConfig;
import com.bank.patterns.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scans the ledger set for one tenant's transactions. Booking dates are stored as epoch
 * days in the {@code txnDate} bin; amounts may arrive as numbers or strings.
 */
@Repository
public class AerospikeLedgerReader implements LedgerReader {

    private static final Logger log = LoggerFactory.getLogger(AerospikeLedgerReader.class);

    private final AerospikeClient client;
    private final String namespace;
    private final ScanPolicy scanPolicy;

    public AerospikeLedgerReader(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.scanPolicy = scanPolicy;
    }

    @Override
    public List<Transaction> read(String tenantId, LocalDate from, LocalDate to) {
        long fromDay = from.toEpochDay();
        long toDay = to.toEpochDay();
        List<Transaction> results = new ArrayList<>();

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_LEDGER_TRANSACTIONS,
                    (key, record) -> {
                        if (!tenantId.equals(text(record, "tenantId"))) return;
                        Object day = record.getValue("txnDate");
                        if (!(day instanceof Number)) return;
                        long epochDay = ((Number) day).longValue();
                        if (epochDay < fromDay || epochDay > toDay) return;
                        synchronized (results) {
                            results.add(mapRecord(tenantId, epochDay, record));
                        }
                    });
        } catch (AerospikeException e) {
            throw new LedgerUnavailableException(tenantId, e);
        }

        results.sort(Comparator.comparing(Transaction::getTransactionDate)
                .thenComparing(Transaction::getTxnId, Comparator.nullsLast(Comparator.naturalOrder())));
        log.debug("Read {} ledger transactions for tenant {} between {} and {}", results.size(), tenantId, from, to);
        return results;
    }

    private Transaction mapRecord(String tenantId, long epochDay, Record record) {
        return Transaction.builder()
                .tenantId(tenantId)
                .txnId(text(record, "txnId"))
                .transactionDate(LocalDate.ofEpochDay(epochDay))
                .description(text(record, "description"))
                .amount(parseAmount(record.getValue("amount")))
                .debitAccount(text(record, "debit"))
                .creditAccount(text(record, "credit"))
                .referenceCode(text(record, "reference"))
                .build();
    }

    // Account numbers are sometimes stored as integers.
    private static String text(Record record, String bin) {
        Object value = record.getValue(bin);
        return value == null ? null : value.toString();
    }

    static Double parseAmount(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim().replace(',', '.'));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
