package com.demoBank.ussdPay.credentials.model;

import com.demoBank.ussdPay.engine.session.SessionSecrets;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BankCredentialsTest {

    @Test
    void testValidCredentials() {
        BankCredentials credentials = credentials();

        assertTrue(credentials.isValid());
        assertTrue(credentials.isValidForLinking());
    }

    @Test
    void testPinAndMobileNumberRules() {
        BankCredentials longPin = credentials();
        longPin.setUpiPin("1234567");
        BankCredentials landline = credentials();
        landline.setMobileNumber("0123456789");

        assertFalse(longPin.isValid());
        assertFalse(landline.isValid());
        assertTrue(longPin.isValidForLinking());
    }

    @Test
    void testLinkingNeedsCardDetails() {
        BankCredentials credentials = credentials();
        credentials.setCardExpiryYear("2028");

        assertFalse(credentials.isValidForLinking());
        assertFalse(credentials.isValid());
    }

    @Test
    void testFormattedCardDetails() {
        assertEquals("1234560628", credentials().getFormattedCardDetails());
        assertEquals("", new BankCredentials().getFormattedCardDetails());
    }

    @Test
    void testBankInput() {
        BankCredentials credentials = credentials();
        assertEquals("SBIN", credentials.getBankInput());

        credentials.setBankIfsc(null);
        assertEquals("State Bank of India", credentials.getBankInput());
    }

    @Test
    void testToSecrets() {
        SessionSecrets secrets = credentials().toSecrets();

        assertEquals("1234", secrets.pin());
        assertEquals("1234560628", secrets.cardVerification());
        assertFalse(secrets.toString().contains("1234"));
    }

    @Test
    void testToStringHidesSecrets() {
        String text = credentials().toString();

        assertFalse(text.contains("upiPin"));
        assertFalse(text.contains("123456"));
        assertTrue(text.contains("State Bank of India"));
    }

    private static BankCredentials credentials() {
        return BankCredentials.builder()
                .upiPin("1234")
                .mobileNumber("9876543210")
                .bankName("State Bank of India")
                .bankIfsc("SBIN0001234")
                .cardLastSixDigits("123456")
                .cardExpiryMonth("06")
                .cardExpiryYear("28")
                .build();
    }
}
