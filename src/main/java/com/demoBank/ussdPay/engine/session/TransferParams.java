package com.demoBank.ussdPay.engine.session;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Send-money parameters.
 *
 * @param recipient mobile number or UPI id
 * @param amount    amount to send; the remote menu only takes whole units
 * @param remarks   free-text remark
 */
public record TransferParams(String recipient, BigDecimal amount, String remarks) {

    public static final String DEFAULT_REMARKS = "payment";

    public TransferParams {
        if (remarks == null || remarks.isBlank()) {
            remarks = DEFAULT_REMARKS;
        }
    }

    /**
     * Amount as sent to the remote menu: whole units, fraction dropped.
     */
    public String amountAnswer() {
        return amount.setScale(0, RoundingMode.DOWN).toPlainString();
    }

    public boolean isUpiId() {
        return recipient.contains("@");
    }

    public boolean isMobileNumber() {
        return recipient.matches("^\\d{10}$");
    }
}
