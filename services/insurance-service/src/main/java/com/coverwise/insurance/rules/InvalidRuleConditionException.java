package com.coverwise.insurance.rules;

import com.coverwise.insurance.exception.InsuranceException;

/**
 * Stored rule condition JSON that cannot be parsed into a {@link RuleCondition}.
 */
public class InvalidRuleConditionException extends InsuranceException {

    public InvalidRuleConditionException(String key, String message) {
        super("INVALID_RULE_CONDITION", String.format("Condition '%s': %s", key, message), key);
    }
}
