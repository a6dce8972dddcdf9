package com.coverwise.insurance.domain;

import com.coverwise.insurance.entity.Claim;
import com.coverwise.insurance.entity.ClaimStatusHistory;

public record ClaimTransitionResult(
    Claim claim,
    ClaimStatusHistory history
) {
}
