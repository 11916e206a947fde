package com.demoBank.ussdPay.gateway.service;

import com.demoBank.ussdPay.config.UssdProperties;
import com.demoBank.ussdPay.credentials.model.BankCredentials;
import com.demoBank.ussdPay.credentials.util.RecipientValidator;
import com.demoBank.ussdPay.device.Dialer;
import com.demoBank.ussdPay.engine.SessionEventListener;
import com.demoBank.ussdPay.engine.UssdAutomationEngine;
import com.demoBank.ussdPay.engine.exception.SessionBusyException;
import com.demoBank.ussdPay.engine.outcome.Outcome;
import com.demoBank.ussdPay.engine.session.TransferParams;
import com.demoBank.ussdPay.engine.session.UssdSession;
import com.demoBank.ussdPay.gateway.exception.InvalidOperationRequestException;
import com.demoBank.ussdPay.gateway.exception.MissingCustomerIdException;
import com.demoBank.ussdPay.gateway.exception.RateLimitExceededException;
import com.demoBank.ussdPay.gateway.exception.SessionNotFoundException;
import com.demoBank.ussdPay.gateway.model.OperationStatus;
import com.demoBank.ussdPay.gateway.model.SessionHandle;
import com.demoBank.ussdPay.gateway.util.SecretMasker;
import com.demoBank.ussdPay.transaction.model.TransactionRecord;
import com.demoBank.ussdPay.transaction.model.TransactionStatus;
import com.demoBank.ussdPay.transaction.model.TransactionType;
import com.demoBank.ussdPay.transaction.service.TransactionRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * USSD session service - entry point for balance checks, payments and bank linking.
 *
 * Responsibilities:
 * - Validate the customer header, credentials and transfer details
 * - Enforce the per-customer session start limit
 * - Start the engine session and dial the short code
 * - Track operation status and transaction records from engine events
 */
@Slf4j
@Service
public class UssdSessionService implements SessionEventListener {

    static final String CANCELLED_MESSAGE = "Cancelled by user";

    private final UssdAutomationEngine engine;
    private final Dialer dialer;
    private final OperationRegistry operationRegistry;
    private final TransactionRecordStore transactionRecordStore;
    private final RateLimiter rateLimiter;
    private final UssdProperties properties;

    public UssdSessionService(UssdAutomationEngine engine,
                              Dialer dialer,
                              OperationRegistry operationRegistry,
                              TransactionRecordStore transactionRecordStore,
                              RateLimiter rateLimiter,
                              UssdProperties properties) {
        this.engine = engine;
        this.dialer = dialer;
        this.operationRegistry = operationRegistry;
        this.transactionRecordStore = transactionRecordStore;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        engine.addListener(this);
    }

    /**
     * Starts a balance check.
     *
     * @param customerIdHeader Customer ID from HTTP header (trusted)
     * @param credentials      bank credentials including the UPI PIN
     * @return handle of the started session
     * @throws SessionBusyException if another session is still running
     */
    public SessionHandle startBalanceCheck(String customerIdHeader, BankCredentials credentials) {
        String customerId = extractAndValidateCustomerId(customerIdHeader);
        requireValidCredentials(credentials);
        validateRateLimit(customerId);

        UssdSession session = UssdSession.balanceCheck(newSessionId(), credentials.toSecrets());
        TransactionRecord record = TransactionRecord.builder()
                .type(TransactionType.BALANCE_CHECK)
                .amount(BigDecimal.ZERO)
                .status(TransactionStatus.PENDING)
                .message("Checking balance...")
                .build();
        return start(customerId, session, record);
    }

    /**
     * Starts a payment.
     *
     * @param customerIdHeader Customer ID from HTTP header (trusted)
     * @param credentials      bank credentials including the UPI PIN
     * @param recipient        10-digit mobile number or UPI id
     * @param amount           amount to send; only whole units reach the bank
     * @param remarks          optional remark
     * @return handle of the started session
     */
    public SessionHandle startSendMoney(String customerIdHeader, BankCredentials credentials,
                                        String recipient, BigDecimal amount, String remarks) {
        String customerId = extractAndValidateCustomerId(customerIdHeader);
        requireValidCredentials(credentials);
        if (!RecipientValidator.isValidRecipient(recipient)) {
            throw new InvalidOperationRequestException("Recipient must be a UPI ID or a 10-digit mobile number");
        }
        if (amount == null || amount.compareTo(BigDecimal.ONE) < 0) {
            throw new InvalidOperationRequestException("Amount must be at least 1");
        }
        validateRateLimit(customerId);

        TransferParams transfer = new TransferParams(recipient, amount, remarks);
        UssdSession session = UssdSession.sendMoney(newSessionId(), credentials.toSecrets(), transfer);
        TransactionRecord record = TransactionRecord.builder()
                .type(TransactionType.SEND)
                .amount(amount)
                .recipient(recipient)
                .remarks(transfer.remarks())
                .status(TransactionStatus.PENDING)
                .message("Payment initiated")
                .build();
        log.info("Send money requested - customerId: {}, recipient: {}",
                SecretMasker.maskCustomerId(customerId), SecretMasker.maskRecipient(recipient));
        return start(customerId, session, record);
    }

    /**
     * Starts linking a bank account. Needs bank and card details only.
     */
    public SessionHandle startLinkBank(String customerIdHeader, BankCredentials credentials) {
        String customerId = extractAndValidateCustomerId(customerIdHeader);
        if (credentials == null || !credentials.isValidForLinking()) {
            throw new InvalidOperationRequestException("Bank name, IFSC and card details are required");
        }
        validateRateLimit(customerId);

        UssdSession session = UssdSession.linkBank(newSessionId(), credentials.toSecrets());
        return start(customerId, session, null);
    }

    /**
     * Cancels an operation of the calling customer.
     *
     * @return the status after cancellation
     * @throws SessionNotFoundException if the customer has no such operation
     */
    public OperationStatus cancel(String customerIdHeader, String sessionId) {
        String customerId = extractAndValidateCustomerId(customerIdHeader);
        OperationStatus status = findOwnedStatus(customerId, sessionId);
        if (engine.cancel(sessionId)) {
            operationRegistry.markCancelled(sessionId);
            transactionRecordStore.findBySessionId(sessionId).ifPresent(record -> {
                record.setStatus(TransactionStatus.FAILED);
                record.setMessage(CANCELLED_MESSAGE);
                transactionRecordStore.save(record);
            });
        } else {
            log.debug("Cancel ignored, session already finished - sessionId: {}", sessionId);
        }
        return status;
    }

    /**
     * Returns the status of an operation of the calling customer.
     *
     * @throws SessionNotFoundException if the customer has no such operation
     */
    public OperationStatus getStatus(String customerIdHeader, String sessionId) {
        String customerId = extractAndValidateCustomerId(customerIdHeader);
        return findOwnedStatus(customerId, sessionId);
    }

    public void addListener(SessionEventListener listener) {
        engine.addListener(listener);
    }

    public void removeListener(SessionEventListener listener) {
        engine.removeListener(listener);
    }

    @Override
    public void onTurn(String sessionId, String turnText) {
        operationRegistry.recordTurn(sessionId, turnText);
    }

    @Override
    public void onOutcome(Outcome outcome) {
        operationRegistry.complete(outcome);
        transactionRecordStore.findBySessionId(outcome.sessionId()).ifPresent(record -> {
            record.setStatus(outcome.success() ? TransactionStatus.SUCCESS : TransactionStatus.FAILED);
            record.setMessage(outcome.finalMessage());
            record.setReferenceId(outcome.referenceId());
            record.setBalance(outcome.balance());
            transactionRecordStore.save(record);
        });
    }

    private SessionHandle start(String customerId, UssdSession session, TransactionRecord record) {
        operationRegistry.register(session, customerId);
        try {
            engine.startSession(session);
        } catch (SessionBusyException e) {
            operationRegistry.remove(session.getSessionId());
            log.warn("Session start rejected, another session is active - customerId: {}",
                    SecretMasker.maskCustomerId(customerId));
            throw e;
        }
        if (record != null) {
            record.setSessionId(session.getSessionId());
            record.setTimestamp(Instant.now());
            transactionRecordStore.save(record);
        }

        log.info("USSD operation started - customerId: {}, sessionId: {}, kind: {}",
                SecretMasker.maskCustomerId(customerId), session.getSessionId(), session.getKind());
        dial(session);
        return new SessionHandle(session.getSessionId(), session.getKind(), session.getStartedAt());
    }

    private void dial(UssdSession session) {
        try {
            dialer.dial(properties.getShortCode());
        } catch (RuntimeException e) {
            log.error("Failed to dial short code - sessionId: {}", session.getSessionId(), e);
            engine.fail(session.getSessionId(), "Failed to initiate USSD session: " + e.getMessage());
        }
    }

    private OperationStatus findOwnedStatus(String customerId, String sessionId) {
        return operationRegistry.find(sessionId)
                .filter(status -> customerId.equals(status.getCustomerId()))
                .orElseThrow(() -> new SessionNotFoundException("Session not found: " + sessionId));
    }

    private void requireValidCredentials(BankCredentials credentials) {
        if (credentials == null || !credentials.isValid()) {
            throw new InvalidOperationRequestException("Incomplete bank credentials");
        }
    }

    /**
     * Extracts and validates customer ID from header.
     *
     * @param customerIdHeader Customer ID from HTTP header
     * @return Validated and trimmed customer ID
     * @throws MissingCustomerIdException if customer ID is missing or blank
     */
    private String extractAndValidateCustomerId(String customerIdHeader) {
        if (customerIdHeader == null || customerIdHeader.isBlank()) {
            log.error("Missing customerId header");
            throw new MissingCustomerIdException("Customer ID header is required");
        }
        return customerIdHeader.trim();
    }

    private void validateRateLimit(String customerId) {
        if (!rateLimiter.isAllowed(customerId)) {
            throw new RateLimitExceededException("Too many USSD sessions started. Please try again later.");
        }
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }
}
