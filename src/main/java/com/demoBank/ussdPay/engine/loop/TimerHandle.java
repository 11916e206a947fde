package com.demoBank.ussdPay.engine.loop;

/**
 * Cancellable token for a scheduled callback.
 */
public interface TimerHandle {

    /**
     * Cancels the callback. A cancelled callback never runs, even if it is already due.
     */
    void cancel();

    boolean isCancelled();
}
