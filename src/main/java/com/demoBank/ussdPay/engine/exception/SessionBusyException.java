package com.demoBank.ussdPay.engine.exception;

/**
 * Thrown when a session is started while another one is still active.
 */
public class SessionBusyException extends RuntimeException {

    private final String activeSessionId;

    public SessionBusyException(String activeSessionId) {
        super("Another USSD session is in progress: " + activeSessionId);
        this.activeSessionId = activeSessionId;
    }

    public String getActiveSessionId() {
        return activeSessionId;
    }
}
