package com.demoBank.ussdPay.gateway.model;

public enum OperationState {
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    CANCELLED
}
