package com.coverwise.insurance.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Fully itemized premium. Every intermediate value is kept so a quote can be audited
 * without recomputation.
 *
 * @param slabName        null when no slab matched and the fallback rate was used
 * @param totalDiscount   rule-based discounts only
 * @param fleetDiscount   applied on top of the rule-based discounts
 */
public record PremiumBreakdown(
    BigDecimal coverageAmount,
    String slabName,
    BigDecimal basePremium,
    List<PremiumLine> coverageLines,
    BigDecimal coveragePremium,
    List<PremiumLine> addonLines,
    BigDecimal addonPremium,
    BigDecimal subtotal,
    BigDecimal riskPercentage,
    String riskCategory,
    BigDecimal riskAdjustment,
    List<AppliedDiscount> appliedDiscounts,
    BigDecimal totalDiscount,
    BigDecimal fleetDiscountPercentage,
    BigDecimal fleetDiscount,
    BigDecimal netPremium,
    BigDecimal gstRate,
    BigDecimal gstAmount,
    BigDecimal totalPremium
) {
    public PremiumBreakdown {
        coverageLines = List.copyOf(coverageLines);
        addonLines = List.copyOf(addonLines);
        appliedDiscounts = List.copyOf(appliedDiscounts);
    }
}
