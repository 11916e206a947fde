package com.demoBank.ussdPay.transaction.controller;

import com.demoBank.ussdPay.transaction.model.TransactionRecord;
import com.demoBank.ussdPay.transaction.service.TransactionRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Transaction history REST controller.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionRecordStore transactionRecordStore;

    @GetMapping
    public ResponseEntity<List<TransactionRecord>> list() {
        return ResponseEntity.ok(transactionRecordStore.findAll());
    }
}
