package com.demoBank.ussdPay.credentials.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Bank reachable over the *99# service.
 *
 * @param name       display name
 * @param ifscPrefix first 4 characters of the bank's IFSC codes
 * @param shortCode  short name shown in USSD menus
 */
public record SupportedBank(String name, String ifscPrefix, String shortCode) {

    public static final List<SupportedBank> ALL = List.of(
            new SupportedBank("State Bank of India", "SBIN", "SBI"),
            new SupportedBank("HDFC Bank", "HDFC", "HDFC"),
            new SupportedBank("ICICI Bank", "ICIC", "ICICI"),
            new SupportedBank("Axis Bank", "UTIB", "AXIS"),
            new SupportedBank("Punjab National Bank", "PUNB", "PNB"),
            new SupportedBank("Bank of Baroda", "BARB", "BOB"),
            new SupportedBank("Kotak Mahindra Bank", "KKBK", "KOTAK"),
            new SupportedBank("Yes Bank", "YESB", "YES"),
            new SupportedBank("IndusInd Bank", "INDB", "INDUS"),
            new SupportedBank("Union Bank of India", "UBIN", "UNION"),
            new SupportedBank("Canara Bank", "CNRB", "CANARA"),
            new SupportedBank("Bank of India", "BKID", "BOI"),
            new SupportedBank("IDBI Bank", "IBKL", "IDBI"),
            new SupportedBank("Central Bank of India", "CBIN", "CBI"),
            new SupportedBank("Indian Bank", "IDIB", "INDIAN"),
            new SupportedBank("Indian Overseas Bank", "IOBA", "IOB"),
            new SupportedBank("UCO Bank", "UCBA", "UCO"),
            new SupportedBank("Federal Bank", "FDRL", "FEDERAL"),
            new SupportedBank("South Indian Bank", "SIBL", "SIB"),
            new SupportedBank("Karnataka Bank", "KARB", "KBL"));

    /**
     * Looks up the bank owning an IFSC code.
     */
    public static Optional<SupportedBank> findByIfsc(String ifsc) {
        if (ifsc == null || ifsc.length() < 4) {
            return Optional.empty();
        }
        String prefix = ifsc.substring(0, 4).toUpperCase(Locale.ROOT);
        return ALL.stream().filter(bank -> bank.ifscPrefix().equals(prefix)).findFirst();
    }
}
