package com.demoBank.ussdPay.engine.outcome;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Recognises turns that end a session.
 * Error wording always wins over success wording on the same text.
 */
@Component
public class TerminalMessageClassifier {

    private static final List<String> ERROR_KEYWORDS = List.of(
            "incorrect", "invalid", "failed", "declined",
            "not registered", "connection problem", "try again",
            "unable to", "could not", "cannot",
            "blocked", "expired", "insufficient",
            "unsuccessful", "not successful",
            "invalid mmi", "payment address incorrect");

    private static final List<String> SUCCESS_KEYWORDS = List.of(
            "success", "completed", "balance is", "available balance");

    public boolean isError(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (ERROR_KEYWORDS.stream().anyMatch(lower::contains)) {
            return true;
        }
        return lower.contains("beneficiary") && lower.contains("incorrect");
    }

    public boolean isSuccess(String text) {
        if (isError(text)) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return SUCCESS_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
