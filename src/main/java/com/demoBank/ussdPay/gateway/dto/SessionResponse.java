package com.demoBank.ussdPay.gateway.dto;

import com.demoBank.ussdPay.engine.outcome.Outcome;
import com.demoBank.ussdPay.engine.session.SessionKind;
import com.demoBank.ussdPay.gateway.model.OperationState;
import com.demoBank.ussdPay.gateway.model.OperationStatus;
import com.demoBank.ussdPay.gateway.model.SessionHandle;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO describing a USSD operation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionResponse {

    private String sessionId;
    private SessionKind kind;
    private OperationState state;
    private String lastTurnText;

    /**
     * Bank's final message, shortened for display. Null while in progress.
     */
    private String message;
    private String referenceId;
    private BigDecimal balance;
    private Instant startedAt;
    private Instant updatedAt;

    public static SessionResponse started(SessionHandle handle) {
        return SessionResponse.builder()
                .sessionId(handle.sessionId())
                .kind(handle.kind())
                .state(OperationState.IN_PROGRESS)
                .startedAt(handle.startedAt())
                .updatedAt(handle.startedAt())
                .build();
    }

    public static SessionResponse from(OperationStatus status) {
        SessionResponseBuilder builder = SessionResponse.builder()
                .sessionId(status.getSessionId())
                .kind(status.getKind())
                .state(status.getState())
                .lastTurnText(status.getLastTurnText())
                .startedAt(status.getStartedAt())
                .updatedAt(status.getUpdatedAt());
        Outcome outcome = status.getOutcome();
        if (outcome != null) {
            builder.message(outcome.summary())
                    .referenceId(outcome.referenceId())
                    .balance(outcome.balance());
        }
        return builder.build();
    }
}
