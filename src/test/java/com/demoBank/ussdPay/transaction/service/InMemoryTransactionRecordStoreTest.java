package com.demoBank.ussdPay.transaction.service;

import com.demoBank.ussdPay.transaction.model.TransactionRecord;
import com.demoBank.ussdPay.transaction.model.TransactionStatus;
import com.demoBank.ussdPay.transaction.model.TransactionType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransactionRecordStoreTest {

    private final InMemoryTransactionRecordStore store = new InMemoryTransactionRecordStore();

    @Test
    void testSaveAssignsId() {
        TransactionRecord saved = store.save(record("s-1", Instant.now()));

        assertNotNull(saved.getId());
        assertSame(saved, store.findBySessionId("s-1").orElseThrow());
    }

    @Test
    void testSaveUpdatesExistingRecord() {
        TransactionRecord saved = store.save(record("s-1", Instant.now()));
        String id = saved.getId();

        saved.setStatus(TransactionStatus.SUCCESS);
        store.save(saved);

        assertEquals(id, saved.getId());
        assertEquals(1, store.findAll().size());
        assertEquals(TransactionStatus.SUCCESS, store.findBySessionId("s-1").orElseThrow().getStatus());
    }

    @Test
    void testFindAllNewestFirst() {
        Instant now = Instant.now();
        store.save(record("s-1", now.minusSeconds(60)));
        store.save(record("s-2", now));
        store.save(record("s-3", now.minusSeconds(30)));

        List<String> sessionIds = store.findAll().stream().map(TransactionRecord::getSessionId).toList();

        assertEquals(List.of("s-2", "s-3", "s-1"), sessionIds);
    }

    @Test
    void testFindUnknownSession() {
        assertTrue(store.findBySessionId("missing").isEmpty());
    }

    private static TransactionRecord record(String sessionId, Instant timestamp) {
        return TransactionRecord.builder()
                .sessionId(sessionId)
                .type(TransactionType.BALANCE_CHECK)
                .status(TransactionStatus.PENDING)
                .timestamp(timestamp)
                .build();
    }
}
