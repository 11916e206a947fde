package com.demoBank.ussdPay.engine.turn;

public enum TurnClassification {
    /** Empty or not protocol content. */
    IGNORED,
    /** New turn carrying an error; ends the session immediately. */
    NEW_ERROR_TERMINAL,
    /** New turn that must settle before it is answered. */
    NEW_NON_TERMINAL,
    /** Same turn seen again. */
    REPEAT_NON_TERMINAL
}
