package com.coverwise.insurance.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of discount rule evaluation: either the sum of the combinable discounts or
 * the single non-combinable discount that beat it, never both.
 */
public record DiscountOutcome(
    List<AppliedDiscount> applied,
    BigDecimal totalDiscount
) {
    public DiscountOutcome {
        applied = List.copyOf(applied);
    }

    public static DiscountOutcome none() {
        return new DiscountOutcome(List.of(), BigDecimal.ZERO);
    }
}
