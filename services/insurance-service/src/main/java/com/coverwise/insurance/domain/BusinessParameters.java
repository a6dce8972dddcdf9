package com.coverwise.insurance.domain;

import java.math.BigDecimal;

/**
 * Immutable snapshot of the business parameters, read once at the start of an operation.
 */
public record BusinessParameters(
    BigDecimal gstRate,
    int quoteValidityDays,
    int claimSlaDays
) {
}
