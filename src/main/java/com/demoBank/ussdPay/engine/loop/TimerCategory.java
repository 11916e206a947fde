package com.demoBank.ussdPay.engine.loop;

/**
 * Kinds of pending engine callbacks. At most one callback per category is pending at a time.
 */
public enum TimerCategory {
    STABILIZE,
    DEFERRED_RESPONSE,
    FOCUS_RETRY,
    SUBMIT_CLICK,
    SUBMIT_COOLDOWN,
    DISMISS,
    SESSION_TIMEOUT
}
