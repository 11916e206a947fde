package com.demoBank.ussdPay.gateway.exception;

/**
 * Exception thrown when a customer starts too many sessions.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
