package com.demoBank.ussdPay.engine.cascade;

import com.demoBank.ussdPay.engine.session.SessionKind;
import com.demoBank.ussdPay.engine.session.TransferParams;
import com.demoBank.ussdPay.engine.session.UssdSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.demoBank.ussdPay.engine.session.ProgressFlag.AMOUNT_SENT;
import static com.demoBank.ussdPay.engine.session.ProgressFlag.BANK_SENT;
import static com.demoBank.ussdPay.engine.session.ProgressFlag.CARD_SENT;
import static com.demoBank.ussdPay.engine.session.ProgressFlag.MENU_SELECTED;
import static com.demoBank.ussdPay.engine.session.ProgressFlag.PAYMENT_METHOD_SELECTED;
import static com.demoBank.ussdPay.engine.session.ProgressFlag.PIN_SENT;
import static com.demoBank.ussdPay.engine.session.ProgressFlag.RECIPIENT_SENT;
import static com.demoBank.ussdPay.engine.session.ProgressFlag.REMARKS_SENT;

/**
 * Response decider - picks the answer to a stabilized turn.
 *
 * Each session kind has a fixed, ordered cascade of rules. The first rule that
 * applies and can produce a value wins and marks its field as answered, so every
 * field is answered at most once per session. The decider does no I/O; it only
 * updates session progress.
 */
@Slf4j
@Component
public class ResponseDecider {

    static final String UPI_ID_FALLBACK_OPTION = "3";
    static final String DEFAULT_PAYMENT_OPTION = "1";

    private final Map<SessionKind, List<CascadeRule>> cascades;

    public ResponseDecider() {
        this.cascades = buildCascades();
    }

    /**
     * Decides what to answer to a turn and records the answered field.
     *
     * @param session active session, progress is updated when a value is returned
     * @param text    stabilized turn text
     * @return the response, or empty to keep waiting for the next turn
     */
    public Optional<ResponseDecision> decide(UssdSession session, String text) {
        CascadeInput input = CascadeInput.of(session, text);
        for (CascadeRule rule : cascadeFor(session.getKind())) {
            if (!rule.appliesTo(input)) {
                continue;
            }
            Optional<String> value = rule.answer().apply(input);
            if (value.isEmpty()) {
                continue;
            }
            if (rule.suppressOnEcho() && text.contains(value.get())) {
                log.debug("Turn already echoes answer, not repeating - sessionId: {}, rule: {}",
                        session.getSessionId(), rule.name());
                return Optional.empty();
            }
            session.markDone(rule.flag());
            log.info("Answering prompt - sessionId: {}, rule: {}, step: {}",
                    session.getSessionId(), rule.name(), session.getStep());
            return Optional.of(new ResponseDecision(rule.name(), rule.flag(), value.get()));
        }
        return Optional.empty();
    }

    public List<CascadeRule> cascadeFor(SessionKind kind) {
        return cascades.get(kind);
    }

    private static Map<SessionKind, List<CascadeRule>> buildCascades() {
        CascadeRule pin = CascadeRule.prompt("pin", PIN_SENT, RuleScope.FREE_FIELD,
                PromptKeywords::asksForPin, input -> input.session().getSecrets().pin(), false);
        CascadeRule bank = CascadeRule.prompt("bank", BANK_SENT, RuleScope.FREE_FIELD,
                PromptKeywords::asksForBank, input -> input.session().getSecrets().bankAnswer(), false);
        CascadeRule card = CascadeRule.prompt("card", CARD_SENT, RuleScope.FREE_FIELD,
                PromptKeywords::asksForCard, input -> input.session().getSecrets().cardVerification(), false);

        Map<SessionKind, List<CascadeRule>> cascades = new EnumMap<>(SessionKind.class);
        cascades.put(SessionKind.BALANCE_CHECK, List.of(
                CascadeRule.menuOption("balance menu", MENU_SELECTED, null, PromptKeywords.BALANCE_MENU),
                pin,
                bank,
                card));
        cascades.put(SessionKind.SEND_MONEY, List.of(
                CascadeRule.menuOption("send money menu", MENU_SELECTED, null, PromptKeywords.SEND_MONEY_MENU),
                new CascadeRule("payment method", PAYMENT_METHOD_SELECTED, RuleScope.MENU, MENU_SELECTED,
                        input -> PromptKeywords.containsAny(input.lowerText(), PromptKeywords.PAYMENT_METHOD_TRIGGERS),
                        ResponseDecider::paymentMethodOption,
                        false),
                pin,
                bank,
                card,
                CascadeRule.prompt("recipient", RECIPIENT_SENT, RuleScope.FREE_FIELD,
                        PromptKeywords::asksForRecipient, input -> input.session().getTransfer().recipient(), true),
                CascadeRule.prompt("amount", AMOUNT_SENT, RuleScope.FREE_FIELD,
                        PromptKeywords::asksForAmount, input -> input.session().getTransfer().amountAnswer(), true),
                CascadeRule.prompt("remarks", REMARKS_SENT, RuleScope.FREE_FIELD,
                        PromptKeywords::asksForRemarks, input -> input.session().getTransfer().remarks(), false)));
        // Link-bank asks for bank and card details whether or not the turn looks like a menu.
        cascades.put(SessionKind.LINK_BANK, List.of(
                CascadeRule.prompt("bank", BANK_SENT, RuleScope.ANY,
                        PromptKeywords::asksForBank, input -> input.session().getSecrets().bankAnswer(), false),
                CascadeRule.prompt("card", CARD_SENT, RuleScope.ANY,
                        PromptKeywords::asksForCard, input -> input.session().getSecrets().cardVerification(), false),
                CascadeRule.menuOption("profile menu", MENU_SELECTED, null, PromptKeywords.PROFILE_MENU),
                CascadeRule.menuOption("change bank menu", PAYMENT_METHOD_SELECTED, MENU_SELECTED,
                        PromptKeywords.CHANGE_BANK_MENU)));
        return cascades;
    }

    private static Optional<String> paymentMethodOption(CascadeInput input) {
        TransferParams transfer = input.session().getTransfer();
        if (transfer.isUpiId()) {
            return Optional.of(input.menu().findOption(PromptKeywords.UPI_ID_OPTION).orElse(UPI_ID_FALLBACK_OPTION));
        }
        if (transfer.isMobileNumber()) {
            return Optional.of(input.menu().findOption(PromptKeywords.MOBILE_OPTION).orElse(DEFAULT_PAYMENT_OPTION));
        }
        return Optional.of(DEFAULT_PAYMENT_OPTION);
    }
}
