package com.demoBank.ussdPay.transaction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payment or balance check run over USSD.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionRecord {

    private String id;

    /**
     * Engine session that produced this record.
     */
    private String sessionId;

    private TransactionType type;

    private BigDecimal amount;

    /**
     * Mobile number or UPI id, null for balance checks.
     */
    private String recipient;

    /**
     * Remark entered by the customer.
     */
    private String remarks;

    private TransactionStatus status;

    private Instant timestamp;

    /**
     * Last message shown by the bank.
     */
    private String message;

    private String referenceId;

    private BigDecimal balance;

    public PaymentCategory getCategory() {
        return type == TransactionType.SEND ? PaymentCategory.categorize(remarks) : PaymentCategory.OTHER;
    }
}
