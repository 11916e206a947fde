package com.demoBank.ussdPay.engine.cascade;

import com.demoBank.ussdPay.engine.session.ProgressFlag;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of a response cascade.
 *
 * @param name           label used in logs
 * @param flag           field this rule answers; the rule is skipped once it is set
 * @param scope          kind of turn the rule applies to
 * @param prerequisite   field that must already be answered, or null
 * @param trigger        whether the turn asks for this field
 * @param answer         value to send; empty when the rule cannot answer this turn
 * @param suppressOnEcho stop without answering when the turn already shows the value
 */
public record CascadeRule(
        String name,
        ProgressFlag flag,
        RuleScope scope,
        ProgressFlag prerequisite,
        Predicate<CascadeInput> trigger,
        Function<CascadeInput, Optional<String>> answer,
        boolean suppressOnEcho
) {

    /**
     * Rule that picks a numbered option by keyword on a menu turn.
     */
    public static CascadeRule menuOption(String name, ProgressFlag flag, ProgressFlag prerequisite,
                                         List<String> keywords) {
        return new CascadeRule(name, flag, RuleScope.MENU, prerequisite,
                input -> true,
                input -> input.menu().findOption(keywords),
                false);
    }

    /**
     * Rule that answers a free-text prompt with a session value.
     */
    public static CascadeRule prompt(String name, ProgressFlag flag, RuleScope scope,
                                     Predicate<String> promptMatcher,
                                     Function<CascadeInput, String> value,
                                     boolean suppressOnEcho) {
        return new CascadeRule(name, flag, scope, null,
                input -> promptMatcher.test(input.lowerText()),
                input -> Optional.ofNullable(value.apply(input)).filter(v -> !v.isBlank()),
                suppressOnEcho);
    }

    public boolean appliesTo(CascadeInput input) {
        if (!scope.admits(input.isMenuTurn()) || input.session().isDone(flag)) {
            return false;
        }
        if (prerequisite != null && !input.session().isDone(prerequisite)) {
            return false;
        }
        return trigger.test(input);
    }
}
