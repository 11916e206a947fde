package com.demoBank.ussdPay.engine.session;

/**
 * Fields a session answers at most once. A set flag never reverts.
 */
public enum ProgressFlag {
    MENU_SELECTED,
    PAYMENT_METHOD_SELECTED,
    PIN_SENT,
    BANK_SENT,
    CARD_SENT,
    RECIPIENT_SENT,
    AMOUNT_SENT,
    REMARKS_SENT
}
