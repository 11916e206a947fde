package com.demoBank.ussdPay.gateway.controller;

import com.demoBank.ussdPay.credentials.model.SupportedBank;
import com.demoBank.ussdPay.gateway.dto.CredentialsRequest;
import com.demoBank.ussdPay.gateway.dto.SendMoneyRequest;
import com.demoBank.ussdPay.gateway.dto.SessionResponse;
import com.demoBank.ussdPay.gateway.model.SessionHandle;
import com.demoBank.ussdPay.gateway.service.UssdSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * USSD REST controller - thin HTTP layer over {@link UssdSessionService}.
 *
 * Operations run asynchronously: start endpoints return 202 with a session id
 * that is polled for progress and the final outcome.
 */
@RestController
@RequestMapping("/api/v1/ussd")
@RequiredArgsConstructor
public class UssdController {

    private static final String CUSTOMER_ID_HEADER = "X-Customer-ID";

    private final UssdSessionService ussdSessionService;

    @PostMapping("/balance")
    public ResponseEntity<SessionResponse> checkBalance(
            @Valid @RequestBody CredentialsRequest request,
            @RequestHeader(value = CUSTOMER_ID_HEADER, required = false) String customerIdHeader) {

        SessionHandle handle = ussdSessionService.startBalanceCheck(customerIdHeader, request.getCredentials());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionResponse.started(handle));
    }

    @PostMapping("/send")
    public ResponseEntity<SessionResponse> sendMoney(
            @Valid @RequestBody SendMoneyRequest request,
            @RequestHeader(value = CUSTOMER_ID_HEADER, required = false) String customerIdHeader) {

        SessionHandle handle = ussdSessionService.startSendMoney(customerIdHeader, request.getCredentials(),
                request.getRecipient(), request.getAmount(), request.getRemarks());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionResponse.started(handle));
    }

    @PostMapping("/link-bank")
    public ResponseEntity<SessionResponse> linkBank(
            @Valid @RequestBody CredentialsRequest request,
            @RequestHeader(value = CUSTOMER_ID_HEADER, required = false) String customerIdHeader) {

        SessionHandle handle = ussdSessionService.startLinkBank(customerIdHeader, request.getCredentials());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionResponse.started(handle));
    }

    /**
     * Progress or outcome of an operation.
     */
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(
            @PathVariable String sessionId,
            @RequestHeader(value = CUSTOMER_ID_HEADER, required = false) String customerIdHeader) {

        return ResponseEntity.ok(SessionResponse.from(ussdSessionService.getStatus(customerIdHeader, sessionId)));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionResponse> cancel(
            @PathVariable String sessionId,
            @RequestHeader(value = CUSTOMER_ID_HEADER, required = false) String customerIdHeader) {

        return ResponseEntity.ok(SessionResponse.from(ussdSessionService.cancel(customerIdHeader, sessionId)));
    }

    @GetMapping("/banks")
    public ResponseEntity<List<SupportedBank>> supportedBanks() {
        return ResponseEntity.ok(SupportedBank.ALL);
    }
}
