package com.demoBank.ussdPay.gateway.exception;

/**
 * Exception thrown when a session request carries invalid credentials or transfer details.
 */
public class InvalidOperationRequestException extends RuntimeException {

    public InvalidOperationRequestException(String message) {
        super(message);
    }
}
