package com.demoBank.ussdPay.transaction.service;

import com.demoBank.ussdPay.transaction.model.TransactionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for transaction records.
 */
public interface TransactionRecordStore {

    TransactionRecord save(TransactionRecord record);

    Optional<TransactionRecord> findBySessionId(String sessionId);

    /**
     * @return all records, newest first
     */
    List<TransactionRecord> findAll();
}
