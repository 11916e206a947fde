package com.demoBank.ussdPay.gateway.service;

import com.demoBank.ussdPay.config.UssdProperties;
import com.demoBank.ussdPay.credentials.model.BankCredentials;
import com.demoBank.ussdPay.device.FakeDevice;
import com.demoBank.ussdPay.engine.SessionEventListener;
import com.demoBank.ussdPay.engine.UssdAutomationEngine;
import com.demoBank.ussdPay.engine.cascade.ResponseDecider;
import com.demoBank.ussdPay.engine.classifier.SnapshotClassifier;
import com.demoBank.ussdPay.engine.exception.SessionBusyException;
import com.demoBank.ussdPay.engine.loop.ManualEventLoop;
import com.demoBank.ussdPay.engine.outcome.Outcome;
import com.demoBank.ussdPay.engine.outcome.OutcomeExtractor;
import com.demoBank.ussdPay.engine.outcome.TerminalMessageClassifier;
import com.demoBank.ussdPay.engine.session.SessionKind;
import com.demoBank.ussdPay.gateway.exception.InvalidOperationRequestException;
import com.demoBank.ussdPay.gateway.exception.MissingCustomerIdException;
import com.demoBank.ussdPay.gateway.exception.RateLimitExceededException;
import com.demoBank.ussdPay.gateway.exception.SessionNotFoundException;
import com.demoBank.ussdPay.gateway.model.OperationState;
import com.demoBank.ussdPay.gateway.model.OperationStatus;
import com.demoBank.ussdPay.gateway.model.SessionHandle;
import com.demoBank.ussdPay.transaction.model.TransactionRecord;
import com.demoBank.ussdPay.transaction.model.TransactionStatus;
import com.demoBank.ussdPay.transaction.model.TransactionType;
import com.demoBank.ussdPay.transaction.service.InMemoryTransactionRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class UssdSessionServiceTest {

    private static final String CUSTOMER_ID = "cust-1234";

    private ManualEventLoop loop;
    private FakeDevice device;
    private UssdAutomationEngine engine;
    private OperationRegistry operationRegistry;
    private InMemoryTransactionRecordStore transactionRecordStore;
    private UssdSessionService service;

    @BeforeEach
    void setUp() {
        service = newService(new UssdProperties());
    }

    @Test
    void testBalanceCheckDialsAndRecordsOutcome() {
        SessionHandle handle = service.startBalanceCheck(CUSTOMER_ID, credentials());

        assertEquals(SessionKind.BALANCE_CHECK, handle.kind());
        assertEquals(List.of("dial:*99#"), device.actions());
        TransactionRecord pending = transactionRecordStore.findBySessionId(handle.sessionId()).orElseThrow();
        assertEquals(TransactionType.BALANCE_CHECK, pending.getType());
        assertEquals(TransactionStatus.PENDING, pending.getStatus());

        device.showAndNotify(FakeDevice.promptScreen("Your available balance is Rs. 12,345.50"));
        loop.advanceMillis(200);

        OperationStatus status = service.getStatus(CUSTOMER_ID, handle.sessionId());
        assertEquals(OperationState.SUCCEEDED, status.getState());
        assertEquals(new BigDecimal("12345.50"), status.getOutcome().balance());
        assertEquals("Your available balance is Rs. 12,345.50", status.getLastTurnText());

        TransactionRecord record = transactionRecordStore.findBySessionId(handle.sessionId()).orElseThrow();
        assertEquals(TransactionStatus.SUCCESS, record.getStatus());
        assertEquals(new BigDecimal("12345.50"), record.getBalance());
    }

    @Test
    void testSendMoneyFailureIsRecorded() {
        SessionHandle handle = service.startSendMoney(CUSTOMER_ID, credentials(), "alice@okbank",
                new BigDecimal("250"), "dinner");

        device.showAndNotify(FakeDevice.infoScreen("Transaction failed. Incorrect UPI PIN"));

        OperationStatus status = service.getStatus(CUSTOMER_ID, handle.sessionId());
        assertEquals(OperationState.FAILED, status.getState());
        TransactionRecord record = transactionRecordStore.findBySessionId(handle.sessionId()).orElseThrow();
        assertEquals(TransactionType.SEND, record.getType());
        assertEquals("alice@okbank", record.getRecipient());
        assertEquals(TransactionStatus.FAILED, record.getStatus());
        assertEquals("Transaction failed. Incorrect UPI PIN", record.getMessage());
        assertTrue(engine.getActiveSession().isEmpty());
    }

    @Test
    void testTurnsAreReportedAsProgress() {
        SessionHandle handle = service.startSendMoney(CUSTOMER_ID, credentials(), "9876543210",
                new BigDecimal("100"), null);

        device.showAndNotify(FakeDevice.promptScreen("Enter UPI PIN"));

        OperationStatus status = service.getStatus(CUSTOMER_ID, handle.sessionId());
        assertEquals(OperationState.IN_PROGRESS, status.getState());
        assertEquals("Enter UPI PIN", status.getLastTurnText());
    }

    @Test
    void testLinkBankNeedsNoPinAndKeepsNoRecord() {
        BankCredentials linkOnly = credentials();
        linkOnly.setUpiPin(null);
        linkOnly.setMobileNumber(null);

        SessionHandle handle = service.startLinkBank(CUSTOMER_ID, linkOnly);

        assertEquals(SessionKind.LINK_BANK, handle.kind());
        assertEquals(List.of("dial:*99#"), device.actions());
        assertTrue(transactionRecordStore.findAll().isEmpty());
    }

    @Test
    void testDialFailureEndsSession() {
        device.failDialWith(new IllegalStateException("no signal"));

        SessionHandle handle = service.startBalanceCheck(CUSTOMER_ID, credentials());

        OperationStatus status = service.getStatus(CUSTOMER_ID, handle.sessionId());
        assertEquals(OperationState.FAILED, status.getState());
        assertEquals("Failed to initiate USSD session: no signal", status.getOutcome().finalMessage());
        assertEquals(TransactionStatus.FAILED,
                transactionRecordStore.findBySessionId(handle.sessionId()).orElseThrow().getStatus());
        assertTrue(engine.getActiveSession().isEmpty());
    }

    @Test
    void testMissingCustomerId() {
        assertThrows(MissingCustomerIdException.class, () -> service.startBalanceCheck(null, credentials()));
        assertThrows(MissingCustomerIdException.class, () -> service.startBalanceCheck("  ", credentials()));
        assertTrue(device.actions().isEmpty());
    }

    @Test
    void testInvalidRequestsAreRejected() {
        BankCredentials shortPin = credentials();
        shortPin.setUpiPin("12");

        assertThrows(InvalidOperationRequestException.class,
                () -> service.startBalanceCheck(CUSTOMER_ID, shortPin));
        assertThrows(InvalidOperationRequestException.class,
                () -> service.startSendMoney(CUSTOMER_ID, credentials(), "not a recipient", BigDecimal.TEN, null));
        assertThrows(InvalidOperationRequestException.class,
                () -> service.startSendMoney(CUSTOMER_ID, credentials(), "9876543210", new BigDecimal("0.50"), null));
        assertThrows(InvalidOperationRequestException.class,
                () -> service.startLinkBank(CUSTOMER_ID, BankCredentials.builder().bankName("SBI").build()));
        assertTrue(device.actions().isEmpty());
    }

    @Test
    void testSecondSessionIsRejectedWhileBusy() {
        service.startBalanceCheck(CUSTOMER_ID, credentials());

        assertThrows(SessionBusyException.class, () -> service.startBalanceCheck("cust-5678", credentials()));

        assertEquals(1, transactionRecordStore.findAll().size());
        assertEquals(List.of("dial:*99#"), device.actions());
    }

    @Test
    void testRateLimit() {
        UssdProperties properties = new UssdProperties();
        properties.setMaxSessionStartsPerMinute(1);
        service = newService(properties);

        SessionHandle handle = service.startBalanceCheck(CUSTOMER_ID, credentials());
        service.cancel(CUSTOMER_ID, handle.sessionId());

        assertThrows(RateLimitExceededException.class, () -> service.startBalanceCheck(CUSTOMER_ID, credentials()));
    }

    @Test
    void testCancel() {
        SessionHandle handle = service.startBalanceCheck(CUSTOMER_ID, credentials());

        OperationStatus status = service.cancel(CUSTOMER_ID, handle.sessionId());

        assertEquals(OperationState.CANCELLED, status.getState());
        assertTrue(engine.getActiveSession().isEmpty());
        TransactionRecord record = transactionRecordStore.findBySessionId(handle.sessionId()).orElseThrow();
        assertEquals(TransactionStatus.FAILED, record.getStatus());
        assertEquals(UssdSessionService.CANCELLED_MESSAGE, record.getMessage());
    }

    @Test
    void testCancelAfterCompletionKeepsOutcome() {
        SessionHandle handle = service.startBalanceCheck(CUSTOMER_ID, credentials());
        device.showAndNotify(FakeDevice.infoScreen("Invalid MMI code"));

        OperationStatus status = service.cancel(CUSTOMER_ID, handle.sessionId());

        assertEquals(OperationState.FAILED, status.getState());
        assertEquals("Invalid MMI code",
                transactionRecordStore.findBySessionId(handle.sessionId()).orElseThrow().getMessage());
    }

    @Test
    void testOtherCustomerCannotSeeSession() {
        SessionHandle handle = service.startBalanceCheck(CUSTOMER_ID, credentials());

        assertThrows(SessionNotFoundException.class, () -> service.getStatus("cust-5678", handle.sessionId()));
        assertThrows(SessionNotFoundException.class, () -> service.cancel("cust-5678", handle.sessionId()));
        assertThrows(SessionNotFoundException.class, () -> service.getStatus(CUSTOMER_ID, "unknown"));
        assertTrue(engine.getActiveSession().isPresent());
    }

    @Test
    void testExtraListenersReceiveOutcome() {
        SessionEventListener listener = mock(SessionEventListener.class);
        service.addListener(listener);

        SessionHandle handle = service.startBalanceCheck(CUSTOMER_ID, credentials());
        device.showAndNotify(FakeDevice.infoScreen("Request declined by bank"));

        ArgumentCaptor<Outcome> captor = ArgumentCaptor.forClass(Outcome.class);
        verify(listener).onOutcome(captor.capture());
        assertEquals(handle.sessionId(), captor.getValue().sessionId());
        assertFalse(captor.getValue().success());
        service.removeListener(listener);
    }

    private UssdSessionService newService(UssdProperties properties) {
        loop = new ManualEventLoop();
        device = new FakeDevice();
        TerminalMessageClassifier terminalClassifier = new TerminalMessageClassifier();
        engine = new UssdAutomationEngine(loop, device, device,
                new SnapshotClassifier(),
                terminalClassifier,
                new ResponseDecider(),
                new OutcomeExtractor(terminalClassifier),
                properties.toEngineTimings(),
                Set.of(FakeDevice.DIALER_PACKAGE));
        device.addListener(engine);
        operationRegistry = new OperationRegistry();
        transactionRecordStore = new InMemoryTransactionRecordStore();
        return new UssdSessionService(engine, device, operationRegistry, transactionRecordStore,
                new RateLimiter(properties), properties);
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
