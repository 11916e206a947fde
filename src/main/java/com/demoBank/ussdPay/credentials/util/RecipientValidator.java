package com.demoBank.ussdPay.credentials.util;

import java.util.regex.Pattern;

/**
 * Validation of payment recipients.
 */
public final class RecipientValidator {

    private static final Pattern UPI_ID = Pattern.compile("^[a-zA-Z0-9._-]+@[a-zA-Z0-9]+$");

    private static final Pattern MOBILE_NUMBER = Pattern.compile("^[6-9]\\d{9}$");

    private RecipientValidator() {
    }

    /**
     * UPI ids look like user@provider.
     */
    public static boolean isValidUpiId(String value) {
        return value != null && UPI_ID.matcher(value).matches();
    }

    /**
     * Indian mobile numbers have 10 digits and start with 6 to 9.
     */
    public static boolean isValidMobileNumber(String value) {
        return value != null && MOBILE_NUMBER.matcher(value).matches();
    }

    public static boolean isValidRecipient(String value) {
        return isValidUpiId(value) || isValidMobileNumber(value);
    }
}
