package com.demoBank.ussdPay.transaction.model;

public enum TransactionStatus {
    PENDING,
    SUCCESS,
    FAILED
}
