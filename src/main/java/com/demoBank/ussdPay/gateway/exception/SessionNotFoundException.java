package com.demoBank.ussdPay.gateway.exception;

/**
 * Exception thrown when a session id is unknown to the caller.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String message) {
        super(message);
    }
}
