package com.demoBank.ussdPay.gateway.model;

import com.demoBank.ussdPay.engine.session.SessionKind;

import java.time.Instant;

/**
 * Reference to a started session, returned to the caller.
 */
public record SessionHandle(String sessionId, SessionKind kind, Instant startedAt) {
}
