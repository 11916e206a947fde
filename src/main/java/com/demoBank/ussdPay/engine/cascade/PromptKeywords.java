package com.demoBank.ussdPay.engine.cascade;

import java.util.List;

/**
 * Vocabulary used to recognise what a USSD turn is asking for.
 * All matchers take lower-case text.
 */
public final class PromptKeywords {

    public static final List<String> BALANCE_MENU = List.of("check balance", "bal enq", "balance enquiry", "know balance");

    public static final List<String> SEND_MONEY_MENU = List.of("send money", "transfer", "pay");

    public static final List<String> PAYMENT_METHOD_TRIGGERS = List.of("send money to", "mobile no", "upi id");

    public static final List<String> UPI_ID_OPTION = List.of("upi id", "vpa");

    public static final List<String> MOBILE_OPTION = List.of("mobile no", "mobile number");

    public static final List<String> PROFILE_MENU = List.of("my profile", "profile", "settings", "my account");

    public static final List<String> CHANGE_BANK_MENU = List.of("change bank", "link bank", "bank account");

    private static final List<String> PIN = List.of("upi pin", "enter pin", "enter your pin", "m-pin", "mpin", "4 digit", "6 digit");

    private static final List<String> BANK = List.of("enter your bank", "bank's name", "bank ifsc", "first 4 letters");

    private static final List<String> CARD = List.of("last 6", "debit card", "card number", "card details");

    private static final List<String> RECIPIENT = List.of("mobile", "vpa", "upi id", "beneficiary", "payee", "enter number", "recipient");

    private static final List<String> AMOUNT = List.of("enter amount", "amount to", "how much");

    private static final List<String> REMARKS = List.of("remark", "comment", "note");

    private PromptKeywords() {
    }

    public static boolean asksForPin(String lower) {
        return containsAny(lower, PIN)
                || (lower.contains("enter") && lower.contains("pin") && !lower.contains("upi id"));
    }

    public static boolean asksForBank(String lower) {
        return containsAny(lower, BANK);
    }

    public static boolean asksForCard(String lower) {
        return containsAny(lower, CARD);
    }

    public static boolean asksForRecipient(String lower) {
        return containsAny(lower, RECIPIENT);
    }

    public static boolean asksForAmount(String lower) {
        return containsAny(lower, AMOUNT);
    }

    public static boolean asksForRemarks(String lower) {
        return containsAny(lower, REMARKS);
    }

    public static boolean containsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
