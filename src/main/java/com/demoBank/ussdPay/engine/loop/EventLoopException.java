package com.demoBank.ussdPay.engine.loop;

/**
 * Thrown when work handed to the event loop could not be completed.
 */
public class EventLoopException extends RuntimeException {

    public EventLoopException(String message) {
        super(message);
    }

    public EventLoopException(String message, Throwable cause) {
        super(message, cause);
    }
}
