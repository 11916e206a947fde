package com.demoBank.ussdPay.engine.session;

import java.util.Locale;

/**
 * Bank secrets a session may need to answer prompts.
 *
 * @param bankRoutingCode     IFSC routing code, may be blank
 * @param bankName            bank display name
 * @param cardVerification    last six card digits followed by MM and YY
 * @param pin                 UPI PIN, blank for sessions that never send one
 */
public record SessionSecrets(
        String bankRoutingCode,
        String bankName,
        String cardVerification,
        String pin
) {

    /**
     * Answer to a bank prompt: the first 4 characters of the routing code, or the
     * bank name when no usable routing code is known.
     */
    public String bankAnswer() {
        if (bankRoutingCode != null && bankRoutingCode.length() >= 4) {
            return bankRoutingCode.substring(0, 4).toUpperCase(Locale.ROOT);
        }
        return bankName;
    }

    @Override
    public String toString() {
        return "SessionSecrets[bankName=" + bankName + ", secrets=****]";
    }
}
