package com.demoBank.ussdPay.engine.cascade;

import com.demoBank.ussdPay.engine.session.UssdSession;
import com.demoBank.ussdPay.engine.turn.MenuPrompt;

import java.util.Locale;

/**
 * What a cascade rule gets to look at: the session and the stabilized turn.
 */
public record CascadeInput(UssdSession session, String text, String lowerText, MenuPrompt menu) {

    public static CascadeInput of(UssdSession session, String text) {
        return new CascadeInput(session, text, text.toLowerCase(Locale.ROOT), MenuPrompt.parse(text));
    }

    public boolean isMenuTurn() {
        return menu.isMenu();
    }
}
