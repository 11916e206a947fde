package com.demoBank.ussdPay.engine.classifier;

import com.demoBank.ussdPay.device.model.ScreenNode;
import com.demoBank.ussdPay.device.util.ScreenTraversal;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Snapshot classifier - pulls the dialog message out of a screen snapshot and decides
 * whether it belongs to the USSD banking menu.
 *
 * The telephony dialog shares the screen with dialer chrome (search boxes, contact
 * labels, the dialed number), which is filtered out before the keyword check.
 */
@Component
public class SnapshotClassifier {

    private static final Set<String> BUTTON_LABELS = Set.of("ok", "cancel", "send", "reply");

    private static final Set<String> CHROME_LABELS = Set.of("search contacts", "contacts", "india");

    private static final Set<String> GENERIC_WORDS = Set.of("call", "chat", "video", "info", "back", "next", "done");

    private static final Pattern MENU_ITEM = Pattern.compile("^\\d+\\..*");

    private static final Pattern DATE_LABEL = Pattern.compile("^[a-z]{3} \\d{1,2}$");

    private static final Pattern PHONE_NUMBER = Pattern.compile("^\\+?\\d{2}\\s?\\d{4,5}\\s?\\d{4,5}$");

    private static final List<String> PROTOCOL_INDICATORS = List.of(
            "1.", "2.", "3.",
            "select option",
            "bank", "upi", "pin",
            "account", "balance",
            "send money", "transfer",
            "request money",
            "enter amount", "amount",
            "mobile", "vpa",
            "success", "fail", "completed",
            "carrier info",
            "enter your", "enter the",
            "debit card", "last 6",
            "ifsc",
            "incorrect", "invalid", "declined",
            "beneficiary", "payment address"
    );

    /**
     * Extracts and classifies the message shown in a snapshot.
     *
     * @param root snapshot root, may be null
     * @return classified text; {@link ClassifiedSnapshot#EMPTY} for a null or text-less screen
     */
    public ClassifiedSnapshot classify(ScreenNode root) {
        if (root == null) {
            return ClassifiedSnapshot.EMPTY;
        }
        String rawText = ScreenTraversal.collectTexts(root).stream()
                .filter(this::isMessageFragment)
                .collect(Collectors.joining("\n"));
        if (rawText.isEmpty()) {
            return ClassifiedSnapshot.EMPTY;
        }
        return new ClassifiedSnapshot(rawText, isProtocolContent(rawText));
    }

    /**
     * Checks whether text contains any USSD banking vocabulary.
     *
     * @param text candidate text
     * @return true if at least one indicator is present
     */
    public boolean isProtocolContent(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return PROTOCOL_INDICATORS.stream().anyMatch(lower::contains);
    }

    private boolean isMessageFragment(String fragment) {
        String trimmed = fragment.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (BUTTON_LABELS.contains(lower)) {
            return false;
        }
        if (trimmed.length() < 3 && !MENU_ITEM.matcher(trimmed).matches()) {
            return false;
        }
        return !isDialerChrome(trimmed, lower);
    }

    private boolean isDialerChrome(String trimmed, String lower) {
        if (CHROME_LABELS.contains(lower) || lower.startsWith("search ") || DATE_LABEL.matcher(lower).matches()) {
            return true;
        }
        if (PHONE_NUMBER.matcher(trimmed).matches()) {
            return true;
        }
        return trimmed.length() < 5 && !MENU_ITEM.matcher(trimmed).matches() && GENERIC_WORDS.contains(lower);
    }
}
