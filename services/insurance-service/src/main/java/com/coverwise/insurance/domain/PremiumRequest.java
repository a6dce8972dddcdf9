package com.coverwise.insurance.domain;

import com.coverwise.insurance.entity.CoverageType;
import com.coverwise.insurance.entity.RiderAddon;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Pricing input for one application: the amount to insure and the resolved selections.
 */
public record PremiumRequest(
    UUID insuranceTypeId,
    BigDecimal coverageAmount,
    List<CoverageType> coverages,
    List<RiderAddon> addons
) {
    public PremiumRequest {
        coverages = coverages == null ? List.of() : List.copyOf(coverages);
        addons = addons == null ? List.of() : List.copyOf(addons);
    }
}
