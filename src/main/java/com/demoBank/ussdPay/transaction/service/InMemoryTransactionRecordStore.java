package com.demoBank.ussdPay.transaction.service;

import com.demoBank.ussdPay.transaction.model.TransactionRecord;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps transaction records in memory for the lifetime of the process.
 */
@Repository
public class InMemoryTransactionRecordStore implements TransactionRecordStore {

    private final Map<String, TransactionRecord> records = new ConcurrentHashMap<>();

    @Override
    public TransactionRecord save(TransactionRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        records.put(record.getId(), record);
        return record;
    }

    @Override
    public Optional<TransactionRecord> findBySessionId(String sessionId) {
        return records.values().stream()
                .filter(record -> sessionId.equals(record.getSessionId()))
                .findFirst();
    }

    @Override
    public List<TransactionRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(TransactionRecord::getTimestamp).reversed())
                .toList();
    }
}
