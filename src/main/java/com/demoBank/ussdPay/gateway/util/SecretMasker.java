package com.demoBank.ussdPay.gateway.util;

/**
 * Utility class for masking identifiers in logs.
 */
public class SecretMasker {

    private SecretMasker() {
    }

    /**
     * Masks a customer ID for logging.
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param customerId The customer ID to mask
     * @return Masked customer ID (e.g., "12****34")
     */
    public static String maskCustomerId(String customerId) {
        if (customerId == null || customerId.length() <= 4) {
            return "****";
        }
        return customerId.substring(0, 2) + "****" + customerId.substring(customerId.length() - 2);
    }

    /**
     * Masks a payment recipient, keeping the last 4 characters of a mobile number
     * or the provider part of a UPI id.
     *
     * @param recipient mobile number or UPI id
     * @return e.g. "******3210" or "****@okbank"
     */
    public static String maskRecipient(String recipient) {
        if (recipient == null || recipient.length() <= 4) {
            return "****";
        }
        int at = recipient.indexOf('@');
        if (at >= 0) {
            return "****" + recipient.substring(at);
        }
        return "*".repeat(recipient.length() - 4) + recipient.substring(recipient.length() - 4);
    }
}
