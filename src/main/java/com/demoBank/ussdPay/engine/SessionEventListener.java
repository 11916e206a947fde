package com.demoBank.ussdPay.engine;

import com.demoBank.ussdPay.engine.outcome.Outcome;

/**
 * Receives progress and results of engine sessions. Called on the engine loop;
 * implementations must not block.
 */
public interface SessionEventListener {

    /**
     * A new turn was shown by the remote side.
     */
    default void onTurn(String sessionId, String turnText) {
    }

    /**
     * The session ended.
     */
    default void onOutcome(Outcome outcome) {
    }
}
