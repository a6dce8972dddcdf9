package com.coverwise.insurance.domain;

import com.coverwise.insurance.entity.CustomerClaimHistory;
import com.coverwise.insurance.entity.CustomerProfile;
import com.coverwise.insurance.entity.Fleet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Everything the pricing and rule evaluation need to know about one customer,
 * loaded once per operation.
 *
 * @param claimHistories most recent year first
 */
public record CustomerContext(
    CustomerProfile customer,
    BigDecimal riskPercentage,
    String riskCategory,
    List<Fleet> activeFleets,
    List<CustomerClaimHistory> claimHistories,
    LocalDate today
) {
    public CustomerContext {
        activeFleets = activeFleets == null ? List.of() : List.copyOf(activeFleets);
        claimHistories = claimHistories == null ? List.of() : List.copyOf(claimHistories);
    }

    public Integer age() {
        return customer != null ? customer.ageOn(today) : null;
    }

    public BigDecimal annualIncome() {
        return customer != null ? customer.getAnnualIncome() : null;
    }

    public Optional<CustomerClaimHistory> latestClaimHistory() {
        return claimHistories.stream().findFirst();
    }

    public Optional<Fleet> primaryFleet() {
        return activeFleets.stream().findFirst();
    }
}
