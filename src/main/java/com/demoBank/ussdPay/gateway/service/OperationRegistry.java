package com.demoBank.ussdPay.gateway.service;

import com.demoBank.ussdPay.engine.outcome.Outcome;
import com.demoBank.ussdPay.engine.session.UssdSession;
import com.demoBank.ussdPay.gateway.model.OperationState;
import com.demoBank.ussdPay.gateway.model.OperationStatus;
import com.demoBank.ussdPay.gateway.util.SecretMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Operation registry - tracks the status of USSD operations using a Caffeine cache.
 *
 * Entries expire after 30 minutes without access, finished or not.
 */
@Slf4j
@Service
public class OperationRegistry {

    private static final Duration STATUS_TTL = Duration.ofMinutes(30);

    private final Cache<String, OperationStatus> statusCache = Caffeine.newBuilder()
            .expireAfterAccess(STATUS_TTL)
            .maximumSize(10_000)
            .removalListener((key, value, cause) -> {
                if (value != null) {
                    OperationStatus status = (OperationStatus) value;
                    log.debug("Operation status evicted - sessionId: {}, customerId: {}, cause: {}",
                            key, SecretMasker.maskCustomerId(status.getCustomerId()), cause);
                }
            })
            .build();

    /**
     * Registers a new operation as in progress.
     *
     * @param session    session the operation runs in
     * @param customerId customer who started it
     * @return the registered status
     */
    public OperationStatus register(UssdSession session, String customerId) {
        Instant now = Instant.now();
        OperationStatus status = OperationStatus.builder()
                .sessionId(session.getSessionId())
                .customerId(customerId)
                .kind(session.getKind())
                .state(OperationState.IN_PROGRESS)
                .startedAt(now)
                .updatedAt(now)
                .build();
        statusCache.put(session.getSessionId(), status);
        return status;
    }

    public Optional<OperationStatus> find(String sessionId) {
        return Optional.ofNullable(statusCache.getIfPresent(sessionId));
    }

    public void recordTurn(String sessionId, String turnText) {
        statusCache.asMap().computeIfPresent(sessionId, (key, status) -> {
            status.setLastTurnText(turnText);
            status.touch();
            return status;
        });
    }

    /**
     * Stores the outcome of a finished operation.
     */
    public void complete(Outcome outcome) {
        statusCache.asMap().computeIfPresent(outcome.sessionId(), (key, status) -> {
            status.setOutcome(outcome);
            status.setState(outcome.success() ? OperationState.SUCCEEDED : OperationState.FAILED);
            status.touch();
            return status;
        });
    }

    public void markCancelled(String sessionId) {
        statusCache.asMap().computeIfPresent(sessionId, (key, status) -> {
            if (status.getState() == OperationState.IN_PROGRESS) {
                status.setState(OperationState.CANCELLED);
                status.touch();
            }
            return status;
        });
    }

    public void remove(String sessionId) {
        statusCache.invalidate(sessionId);
    }
}
