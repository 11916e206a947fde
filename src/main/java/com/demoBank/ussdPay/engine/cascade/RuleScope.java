package com.demoBank.ussdPay.engine.cascade;

/**
 * Kind of turn a cascade rule may answer.
 */
public enum RuleScope {
    MENU,
    FREE_FIELD,
    ANY;

    public boolean admits(boolean menuTurn) {
        return switch (this) {
            case MENU -> menuTurn;
            case FREE_FIELD -> !menuTurn;
            case ANY -> true;
        };
    }
}
