package com.demoBank.ussdPay.engine.outcome;

import com.demoBank.ussdPay.engine.session.SessionKind;
import com.demoBank.ussdPay.engine.session.UssdSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Outcome extractor - turns a terminal turn into an {@link Outcome}.
 *
 * Reference ids and balances are pulled from free text with a few labelled patterns;
 * the first match wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutcomeExtractor {

    private static final Pattern LABELLED_REFERENCE = Pattern.compile(
            "\\b(?:ref(?:erence)?|txn|transaction|utr|rrn)\\b\\.?\\s*(?:no|id|number)?\\.?\\s*[:#-]?\\s*([A-Za-z0-9]*\\d[A-Za-z0-9]*)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_REFERENCE = Pattern.compile("\\b(\\d{12,})\\b");

    private static final String AMOUNT = "([0-9][0-9,]*(?:\\.[0-9]+)?)";

    private static final List<Pattern> BALANCE_PATTERNS = List.of(
            Pattern.compile("\\b(?:balance|bal)\\b[:\\s]*(?:is)?[:\\s]*(?:rs\\.?|inr)?\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:rs\\.?|inr)\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bavailable\\b[:\\s]*(?:rs\\.?|inr)?\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE));

    private final TerminalMessageClassifier terminalClassifier;

    /**
     * Builds the outcome of a session from its terminal turn.
     *
     * @param session session being completed
     * @param success whether the turn was classified as success
     * @param message terminal turn text
     * @return the outcome; balance only for successful balance checks
     */
    public Outcome extract(UssdSession session, boolean success, String message) {
        String referenceId = success ? extractReferenceId(message) : null;
        BigDecimal balance = success && session.getKind() == SessionKind.BALANCE_CHECK ? extractBalance(message) : null;
        return new Outcome(session.getSessionId(), session.getKind(), success, message, referenceId, balance, Instant.now());
    }

    /**
     * Finds a transaction reference in the text.
     *
     * @return the labelled reference code, else the first run of 12 or more digits, else null
     */
    public String extractReferenceId(String message) {
        if (message == null) {
            return null;
        }
        Matcher labelled = LABELLED_REFERENCE.matcher(message);
        if (labelled.find()) {
            return labelled.group(1);
        }
        Matcher bare = BARE_REFERENCE.matcher(message);
        return bare.find() ? bare.group(1) : null;
    }

    /**
     * Finds a balance in a success message.
     *
     * @return the balance with thousands separators removed, or null when the text
     * is an error or carries no readable amount
     */
    public BigDecimal extractBalance(String message) {
        if (message == null || terminalClassifier.isError(message)) {
            return null;
        }
        for (Pattern pattern : BALANCE_PATTERNS) {
            Matcher matcher = pattern.matcher(message);
            while (matcher.find()) {
                try {
                    return new BigDecimal(matcher.group(1).replace(",", ""));
                } catch (NumberFormatException e) {
                    log.debug("Skipping unreadable amount: {}", matcher.group(1));
                }
            }
        }
        return null;
    }
}
