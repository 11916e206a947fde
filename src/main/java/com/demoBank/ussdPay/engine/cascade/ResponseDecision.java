package com.demoBank.ussdPay.engine.cascade;

import com.demoBank.ussdPay.engine.session.ProgressFlag;

/**
 * Value chosen as the answer to a turn.
 *
 * @param rule  name of the cascade rule that fired
 * @param field field the value answers
 * @param value text to inject
 */
public record ResponseDecision(String rule, ProgressFlag field, String value) {

    @Override
    public String toString() {
        // value may be a PIN or card digits
        return "ResponseDecision[" + rule + ", " + field + "]";
    }
}
