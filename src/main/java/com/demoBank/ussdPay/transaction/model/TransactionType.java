package com.demoBank.ussdPay.transaction.model;

public enum TransactionType {
    SEND,
    RECEIVE,
    BALANCE_CHECK
}
