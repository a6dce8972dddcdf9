package com.coverwise.insurance.domain;

import java.math.BigDecimal;

/**
 * Suitability score of one quote; every component is on a 0-100 scale, rounded to 2 decimals.
 */
public record QuoteScore(
    BigDecimal overall,
    BigDecimal affordability,
    BigDecimal claimRatio,
    BigDecimal coverage,
    BigDecimal serviceRating,
    String rationale
) {
}
