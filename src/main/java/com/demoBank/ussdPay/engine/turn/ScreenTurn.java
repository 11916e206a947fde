package com.demoBank.ussdPay.engine.turn;

import java.util.Locale;

/**
 * One observed unit of remote output.
 *
 * @param text        raw turn text
 * @param fingerprint hash of the text used to tell a new turn from a repeated one
 * @param observedAt  loop time at which the turn was first seen
 */
public record ScreenTurn(String text, int fingerprint, long observedAt) {

    public static ScreenTurn of(String text, long observedAt) {
        return new ScreenTurn(text, fingerprintOf(text), observedAt);
    }

    public static int fingerprintOf(String text) {
        return text.hashCode();
    }

    public String lowerText() {
        return text.toLowerCase(Locale.ROOT);
    }

    /**
     * Turn text cut down for logs and progress displays.
     */
    public String preview(int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
