package com.demoBank.ussdPay.device;

/**
 * Starts a USSD session with the carrier.
 */
public interface Dialer {

    /**
     * Dials the given short code.
     *
     * @param shortCode USSD short code, e.g. "*99#"
     */
    void dial(String shortCode);
}
