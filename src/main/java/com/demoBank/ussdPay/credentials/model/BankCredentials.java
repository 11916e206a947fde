package com.demoBank.ussdPay.credentials.model;

import com.demoBank.ussdPay.engine.session.SessionSecrets;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Bank details a customer registered for USSD payments.
 *
 * Held in memory for the duration of a request only; never persisted or logged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BankCredentials {

    @ToString.Exclude
    private String upiPin;

    private String mobileNumber;

    private String bankName;

    /**
     * 11 character IFSC code of the customer's branch.
     */
    private String bankIfsc;

    @ToString.Exclude
    private String cardLastSixDigits;

    @ToString.Exclude
    private String cardExpiryMonth;

    @ToString.Exclude
    private String cardExpiryYear;

    /**
     * Card details as the USSD menu expects them: last six digits, then MM, then YY.
     */
    @JsonIgnore
    public String getFormattedCardDetails() {
        return nullToEmpty(cardLastSixDigits) + nullToEmpty(cardExpiryMonth) + nullToEmpty(cardExpiryYear);
    }

    /**
     * Answer to a bank prompt: first 4 characters of the IFSC code, or the bank name.
     */
    @JsonIgnore
    public String getBankInput() {
        return toSecrets().bankAnswer();
    }

    /**
     * Whether every field needed for payments and balance checks is filled in.
     */
    @JsonIgnore
    public boolean isValid() {
        return upiPin != null && upiPin.length() >= 4 && upiPin.length() <= 6
                && mobileNumber != null && mobileNumber.length() == 10
                && mobileNumber.charAt(0) >= '6' && mobileNumber.charAt(0) <= '9'
                && isValidForLinking();
    }

    /**
     * Linking a bank account only needs bank and card details.
     */
    @JsonIgnore
    public boolean isValidForLinking() {
        return bankName != null && !bankName.isBlank()
                && bankIfsc != null && bankIfsc.length() == 11
                && cardLastSixDigits != null && cardLastSixDigits.length() == 6
                && cardExpiryMonth != null && cardExpiryMonth.length() == 2
                && cardExpiryYear != null && cardExpiryYear.length() == 2;
    }

    public SessionSecrets toSecrets() {
        return new SessionSecrets(bankIfsc, bankName, getFormattedCardDetails(), upiPin);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
