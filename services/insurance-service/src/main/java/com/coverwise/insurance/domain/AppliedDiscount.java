package com.coverwise.insurance.domain;

import java.math.BigDecimal;

public record AppliedDiscount(
    String ruleCode,
    String ruleName,
    BigDecimal amount,
    boolean combinable
) {
}
