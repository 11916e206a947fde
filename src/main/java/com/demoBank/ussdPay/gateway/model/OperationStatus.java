package com.demoBank.ussdPay.gateway.model;

import com.demoBank.ussdPay.engine.outcome.Outcome;
import com.demoBank.ussdPay.engine.session.SessionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress of one USSD operation as seen by the caller.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OperationStatus {

    private String sessionId;

    /**
     * Customer who started the operation. Only they may query or cancel it.
     */
    private String customerId;

    private SessionKind kind;

    private OperationState state;

    /**
     * Latest text shown by the USSD dialog, for progress display.
     */
    private String lastTurnText;

    /**
     * Set once the operation has finished, null while in progress or after cancellation.
     */
    private Outcome outcome;

    private Instant startedAt;

    private Instant updatedAt;

    public void touch() {
        this.updatedAt = Instant.now();
    }
}
