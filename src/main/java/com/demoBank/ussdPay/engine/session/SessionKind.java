package com.demoBank.ussdPay.engine.session;

/**
 * The three operations the engine can drive through the USSD menu.
 */
public enum SessionKind {
    BALANCE_CHECK,
    SEND_MONEY,
    LINK_BANK
}
