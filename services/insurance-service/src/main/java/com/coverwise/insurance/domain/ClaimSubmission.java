package com.coverwise.insurance.domain;

import com.coverwise.insurance.entity.Claim.ClaimType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record ClaimSubmission(
    UUID customerId,
    UUID insuranceTypeId,
    String policyNumber,
    ClaimType claimType,
    LocalDate incidentDate,
    String description,
    BigDecimal amountRequested
) {
}
