package com.demoBank.ussdPay.engine.outcome;

import com.demoBank.ussdPay.engine.session.SessionKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Terminal result of a session. Produced at most once per session.
 *
 * @param sessionId    session the outcome belongs to
 * @param kind         operation that was run
 * @param success      whether the remote side reported success
 * @param finalMessage terminal turn text
 * @param referenceId  transaction reference, null if none was found
 * @param balance      balance, null unless a balance check reported one
 * @param completedAt  when the outcome was produced
 */
public record Outcome(
        String sessionId,
        SessionKind kind,
        boolean success,
        String finalMessage,
        String referenceId,
        BigDecimal balance,
        Instant completedAt
) {

    public static final int SUMMARY_LENGTH = 160;

    public static Outcome failure(String sessionId, SessionKind kind, String message) {
        return new Outcome(sessionId, kind, false, message, null, null, Instant.now());
    }

    /**
     * Final message cut down for display.
     */
    public String summary() {
        if (finalMessage == null) {
            return "";
        }
        return finalMessage.length() <= SUMMARY_LENGTH ? finalMessage : finalMessage.substring(0, SUMMARY_LENGTH) + "...";
    }
}
