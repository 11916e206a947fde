package com.demoBank.ussdPay.engine.cascade;

import com.demoBank.ussdPay.engine.session.ProgressFlag;
import com.demoBank.ussdPay.engine.session.SessionSecrets;
import com.demoBank.ussdPay.engine.session.TransferParams;
import com.demoBank.ussdPay.engine.session.UssdSession;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseDeciderTest {

    private static final SessionSecrets SECRETS =
            new SessionSecrets("SBIN0001234", "State Bank of India", "1234560628", "1234");

    private static final String MAIN_MENU = "Welcome to *99#\n1. Send Money\n2. Check Balance\n3. Request Money";

    private final ResponseDecider decider = new ResponseDecider();

    @Test
    void testSendMoneyPicksSendOption() {
        UssdSession session = sendMoney("9876543210", "500");

        assertEquals(Optional.of("1"), answer(session, "1. Send Money 2. Check Balance"));
        assertTrue(session.isDone(ProgressFlag.MENU_SELECTED));
    }

    @Test
    void testBalanceCheckPicksBalanceOption() {
        UssdSession session = UssdSession.balanceCheck("s-1", SECRETS);

        assertEquals(Optional.of("2"), answer(session, "1. Send Money 2. Check Balance"));
        assertTrue(session.isDone(ProgressFlag.MENU_SELECTED));
    }

    @Test
    void testMenuWithoutMatchingOptionIsNotAnswered() {
        UssdSession session = UssdSession.balanceCheck("s-1", SECRETS);

        assertEquals(Optional.empty(), answer(session, "1. Language\n2. Help"));
        assertFalse(session.isDone(ProgressFlag.MENU_SELECTED));
    }

    @Test
    void testPaymentMethodFollowsRecipientShape() {
        String methodMenu = "Send money to\n1. Mobile No\n2. Saved Beneficiary\n3. UPI ID\n4. IFSC & Account";

        UssdSession toMobile = sendMoney("9876543210", "500");
        answer(toMobile, MAIN_MENU);
        assertEquals(Optional.of("1"), answer(toMobile, methodMenu));
        assertTrue(toMobile.isDone(ProgressFlag.PAYMENT_METHOD_SELECTED));

        UssdSession toUpiId = sendMoney("alice@okbank", "500");
        answer(toUpiId, MAIN_MENU);
        assertEquals(Optional.of("3"), answer(toUpiId, methodMenu));
    }

    @Test
    void testPaymentMethodFallsBackWhenNoOptionMatches() {
        UssdSession session = sendMoney("alice@okbank", "500");
        answer(session, MAIN_MENU);

        assertEquals(Optional.of("3"), answer(session, "Send money to\n1. Saved Beneficiary\n2. IFSC & Account"));
    }

    @Test
    void testPaymentMethodRequiresMainMenuFirst() {
        UssdSession session = sendMoney("alice@okbank", "500");

        assertEquals(Optional.empty(), answer(session, "Send money to\n1. Mobile No\n2. UPI ID"));
        assertFalse(session.isDone(ProgressFlag.PAYMENT_METHOD_SELECTED));
    }

    @Test
    void testPinIsAnsweredOnce() {
        UssdSession session = UssdSession.balanceCheck("s-1", SECRETS);

        assertEquals(Optional.of("1234"), answer(session, "Enter UPI PIN"));
        assertEquals(Optional.empty(), answer(session, "Enter UPI PIN"));
        assertEquals(1, session.getStep());
    }

    @Test
    void testPinTakesPriorityOverAmount() {
        UssdSession session = sendMoney("9876543210", "500");

        assertEquals(Optional.of("1234"), answer(session, "Enter amount to send and your UPI PIN"));
        assertFalse(session.isDone(ProgressFlag.AMOUNT_SENT));
        assertEquals(Optional.of("500"), answer(session, "Enter amount to send and your UPI PIN"));
    }

    @Test
    void testBankAndCardAnswers() {
        UssdSession session = UssdSession.balanceCheck("s-1", SECRETS);

        assertEquals(Optional.of("SBIN"), answer(session, "Enter first 4 letters of your bank IFSC"));
        assertEquals(Optional.of("1234560628"), answer(session, "Enter debit card last six digits and expiry MMYY"));
    }

    @Test
    void testBankAnswerFallsBackToBankName() {
        SessionSecrets noIfsc = new SessionSecrets("", "Canara Bank", "1234560628", "1234");
        UssdSession session = UssdSession.balanceCheck("s-1", noIfsc);

        assertEquals(Optional.of("Canara Bank"), answer(session, "Enter your bank's name"));
    }

    @Test
    void testAmountEchoIsNotAnsweredAgain() {
        UssdSession session = sendMoney("9876543210", "500");

        assertEquals(Optional.empty(), answer(session, "Enter amount: you are sending 500"));
        assertFalse(session.isDone(ProgressFlag.AMOUNT_SENT));
    }

    @Test
    void testRecipientEchoIsNotAnsweredAgain() {
        UssdSession session = sendMoney("9876543210", "500");

        assertEquals(Optional.empty(), answer(session, "Enter mobile number: 9876543210"));
        assertFalse(session.isDone(ProgressFlag.RECIPIENT_SENT));
        assertEquals(Optional.of("9876543210"), answer(session, "Enter payee mobile number"));
    }

    @Test
    void testSendMoneyFreeFieldCascade() {
        UssdSession session = sendMoney("alice@okbank", "1500.75");

        assertEquals(Optional.of("alice@okbank"), answer(session, "Enter UPI ID of the payee"));
        assertEquals(Optional.of("1500"), answer(session, "Enter amount in Rs"));
        assertEquals(Optional.of("lunch"), answer(session, "Enter a remark for this payment"));
        assertEquals(3, session.getStep());
    }

    @Test
    void testLinkBankCascade() {
        UssdSession session = UssdSession.linkBank("s-1", SECRETS);

        assertEquals(Optional.of("4"), answer(session, "1. Send Money\n2. Check Balance\n3. Request Money\n4. My Profile"));
        assertEquals(Optional.of("2"), answer(session, "1. Change Language\n2. Change Bank Account\n3. Change UPI PIN"));
        assertEquals(Optional.of("SBIN"), answer(session, "Enter first 4 letters of your bank IFSC"));
        assertEquals(Optional.of("1234560628"), answer(session, "Enter debit card last six digits and expiry MMYY"));
        assertTrue(session.isDone(ProgressFlag.PAYMENT_METHOD_SELECTED));
    }

    @Test
    void testLinkBankNeverSendsPin() {
        UssdSession session = UssdSession.linkBank("s-1", SECRETS);

        assertEquals(Optional.empty(), answer(session, "Enter UPI PIN"));
    }

    @Test
    void testUnrelatedTurnIsNotAnswered() {
        UssdSession session = sendMoney("9876543210", "500");

        assertEquals(Optional.empty(), answer(session, "Please wait while we process your request"));
        assertTrue(session.getProgress().isEmpty());
    }

    private Optional<String> answer(UssdSession session, String text) {
        return decider.decide(session, text).map(ResponseDecision::value);
    }

    private static UssdSession sendMoney(String recipient, String amount) {
        return UssdSession.sendMoney("s-1", SECRETS, new TransferParams(recipient, new BigDecimal(amount), "lunch"));
    }
}
